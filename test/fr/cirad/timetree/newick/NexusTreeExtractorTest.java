package fr.cirad.timetree.newick;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.BufferedReader;
import java.io.StringReader;

import org.junit.jupiter.api.Test;

class NexusTreeExtractorTest {

	private static String extract(String source) throws Exception {
		return NexusTreeExtractor.extractNewick(new BufferedReader(new StringReader(source)));
	}

	@Test
	void returnsFirstLineOfPlainNewickSource() throws Exception {
		assertThat(extract("  (A,B);  \n(C,D);\n")).isEqualTo("(A,B);");
	}

	@Test
	void extractsTreeStatementFromNexusSource() throws Exception {
		assertThat(extract("#NEXUS\ntree foo = (A,B);\n")).isEqualTo("(A,B);");
	}

	@Test
	void matchesHeaderAndStatementCaseInsensitively() throws Exception {
		String nexus = " #nexus \n"
				+ "Begin taxa;\n"
				+ "  Dimensions ntax=2;\n"
				+ "End;\n"
				+ "Begin trees;\n"
				+ "  TREE t1 = (A:1,B:2);\n"
				+ "  tree t2 = (C,D);\n"
				+ "End;\n";

		assertThat(extract(nexus)).isEqualTo("(A:1,B:2);");
	}

	@Test
	void keepsEverythingAfterFirstEqualsSign() throws Exception {
		assertThat(extract("#NEXUS\ntree t = A[&k=v];\n")).isEqualTo("A[&k=v];");
	}

	@Test
	void ignoresLinesThatOnlyStartWithTree() throws Exception {
		assertThat(extract("#NEXUS\ntrees = nothing\ntree t = (A,B);\n")).isEqualTo("(A,B);");
	}

	@Test
	void failsWhenNexusSourceHasNoTree() {
		assertThatThrownBy(() -> extract("#NEXUS\nbegin taxa;\nend;\n"))
				.isInstanceOf(TreeSourceFormatException.class)
				.hasMessageContaining("No tree statement");
	}

	@Test
	void failsOnTreeStatementWithoutEqualsSign() {
		assertThatThrownBy(() -> extract("#NEXUS\ntree t (A,B);\n"))
				.isInstanceOf(TreeSourceFormatException.class)
				.hasMessageContaining("line 2");
	}

	@Test
	void failsOnEmptySource() {
		assertThatThrownBy(() -> extract("")).isInstanceOf(TreeSourceFormatException.class);
	}

	@Test
	void recognizesHeaderOnly() {
		assertThat(NexusTreeExtractor.isNexusHeader("#Nexus")).isTrue();
		assertThat(NexusTreeExtractor.isNexusHeader("#NEXUS file")).isFalse();
		assertThat(NexusTreeExtractor.isNexusHeader(null)).isFalse();
	}

	private static TreeStatement statement(String source) throws Exception {
		return NexusTreeExtractor.extractTreeStatement(new BufferedReader(new StringReader(source)));
	}

	@Test
	void tellsWhichLineProvidedTheTree() throws Exception {
		TreeStatement nexus = statement("#NEXUS\nbegin trees;\n  tree t1 = (A,B);\nend;\n");
		TreeStatement plain = statement("(A,B);\n");

		assertThat(nexus.isNexus()).isTrue();
		assertThat(nexus.getLineNumber()).isEqualTo(3);
		assertThat(nexus.getNewick()).isEqualTo("(A,B);");
		assertThat(plain.isNexus()).isFalse();
		assertThat(plain.getLineNumber()).isEqualTo(1);
	}

	@Test
	void ignoresByteOrderMark() throws Exception {
		assertThat(extract("\uFEFF#NEXUS\ntree t = (A,B);\n")).isEqualTo("(A,B);");
		assertThat(extract("\uFEFF(C,D);\n")).isEqualTo("(C,D);");
	}
}
