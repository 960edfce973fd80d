package fr.cirad.timetree.tools;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Properties;

import org.junit.jupiter.api.Test;

class AppConfigTest {

	@Test
	void loadsDefaultsFromClasspath() throws Exception {
		AppConfig appConfig = new AppConfig();

		assertThat(appConfig.get("newick.branchLengthFormat")).isEmpty();
		assertThat(appConfig.getBoolean("newick.rejectNegativeBranchLengths", true)).isFalse();
		assertThat(appConfig.getInt("ascii.width", 0)).isEqualTo(70);
		assertThat(appConfig.get("no.such.key")).isNull();
	}

	@Test
	void fallsBackToDefaultsOnInvalidValues() {
		Properties props = new Properties();
		props.setProperty("width", "wide");
		props.setProperty("flag", "yes");
		props.setProperty("padded", "  12 ");
		AppConfig appConfig = new AppConfig(props);

		assertThat(appConfig.getInt("width", 42)).isEqualTo(42);
		assertThat(appConfig.getBoolean("flag", true)).isTrue();
		assertThat(appConfig.getInt("padded", 0)).isEqualTo(12);
		assertThat(appConfig.getInt("missing", 7)).isEqualTo(7);
	}
}
