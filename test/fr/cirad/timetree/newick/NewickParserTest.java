package fr.cirad.timetree.newick;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.entry;

import org.junit.jupiter.api.Test;

import fr.cirad.timetree.model.Node;

class NewickParserTest {

	private final NewickParser parser = new NewickParser();

	@Test
	void buildsNestedStructureWithParentLinks() throws Exception {
		Node root = parser.parse("((A:1,B:2)C:3,D:4)E:5;");

		assertThat(root.getLabel()).isEqualTo("E");
		assertThat(root.getParent()).isNull();
		assertThat(root.getBranchLength()).isEqualTo(5.0);
		assertThat(root.getChildren()).extracting(Node::getLabel).containsExactly("C", "D");

		Node c = root.getChildren().get(0);
		assertThat(c.getParent()).isSameAs(root);
		assertThat(c.getChildren()).extracting(Node::getLabel).containsExactly("A", "B");
		assertThat(c.getChildren()).extracting(Node::getBranchLength).containsExactly(1.0, 2.0);
		assertThat(c.getChildren().get(1).getParent()).isSameAs(c);
	}

	@Test
	void missingBranchLengthDefaultsToOne() throws Exception {
		Node root = parser.parse("(A,B);");

		assertThat(root.getChildren()).hasSize(2);
		assertThat(root.getChildren()).extracting(Node::getBranchLength).containsExactly(1.0, 1.0);
		assertThat(root.getBranchLength()).isEqualTo(1.0);
		assertThat(root.getLabel()).isNull();
	}

	@Test
	void keepsAnnotationsInInsertionOrder() throws Exception {
		Node node = parser.parse("A[&rate=\"0.5\",region=\"EU\"];");

		assertThat(node.getLabel()).isEqualTo("A");
		assertThat(node.getAnnotations()).containsExactly(entry("rate", "0.5"), entry("region", "EU"));
	}

	@Test
	void acceptsBareAndSingleQuotedAnnotations() throws Exception {
		Node node = parser.parse("(A,B)[&'host species'=bat,n=3]:2;");

		assertThat(node.getAnnotations()).containsExactly(entry("host species", "bat"), entry("n", "3"));
		assertThat(node.getBranchLength()).isEqualTo(2.0);
	}

	@Test
	void stripsQuotesFromLabels() throws Exception {
		Node root = parser.parse("('Homo sapiens':1,\"Pan\":2);");

		assertThat(root.getChildren()).extracting(Node::getLabel).containsExactly("Homo sapiens", "Pan");
	}

	@Test
	void parsesExponentNotation() throws Exception {
		assertThat(parser.parse("A:1e-3;").getBranchLength()).isEqualTo(0.001);
		assertThat(parser.parse("A:2.5E2;").getBranchLength()).isEqualTo(250.0);
	}

	@Test
	void parsesSemicolonOnlyAsSingleUnlabelledNode() throws Exception {
		Node node = parser.parse(";");

		assertThat(node.isLeaf()).isTrue();
		assertThat(node.getLabel()).isNull();
		assertThat(node.getBranchLength()).isEqualTo(1.0);
	}

	@Test
	void rejectsMissingClosingParenthesis() {
		NewickParseException npe = catchThrowableOfType(() -> parser.parse("(A,B;"), NewickParseException.class);

		assertThat(npe).isNotNull();
		assertThat(npe.getTokenKind()).isEqualTo(TokenKind.SEMI);
		assertThat(npe.getTokenIndex()).isEqualTo(4);
		assertThat(npe.getTokenValue()).isNull();
	}

	@Test
	void rejectsNonNumericBranchLength() {
		NewickParseException npe = catchThrowableOfType(() -> parser.parse("A:xyz;"), NewickParseException.class);

		assertThat(npe).isNotNull().hasCauseInstanceOf(NumberFormatException.class);
		assertThat(npe.getTokenKind()).isEqualTo(TokenKind.STRING);
		assertThat(npe.getTokenValue()).isEqualTo("xyz");
		assertThat(npe.getTokenIndex()).isEqualTo(2);
	}

	@Test
	void rejectsJavaSpecificNumberSyntax() {
		assertThatThrownBy(() -> parser.parse("A:1.5f;")).isInstanceOf(NewickParseException.class);
		assertThatThrownBy(() -> parser.parse("A:NaN;")).isInstanceOf(NewickParseException.class);
		assertThatThrownBy(() -> parser.parse("A:Infinity;")).isInstanceOf(NewickParseException.class);
	}

	@Test
	void rejectsOverflowingBranchLength() {
		assertThatThrownBy(() -> parser.parse("A:1e999;"))
				.isInstanceOf(NewickParseException.class)
				.hasMessageContaining("out of range");
	}

	@Test
	void rejectsMissingSemicolon() {
		assertThat(catchThrowableOfType(() -> parser.parse("A:1.5"), NewickParseException.class).getTokenKind()).isEqualTo(TokenKind.END);
	}

	@Test
	void rejectsTokensAfterSemicolon() {
		NewickParseException npe = catchThrowableOfType(() -> parser.parse("A;B"), NewickParseException.class);

		assertThat(npe).isNotNull();
		assertThat(npe.getTokenKind()).isEqualTo(TokenKind.STRING);
		assertThat(npe.getTokenValue()).isEqualTo("B");
		assertThat(npe.getTokenIndex()).isEqualTo(2);
	}

	@Test
	void rejectsIncompleteAnnotationPair() {
		assertThat(catchThrowableOfType(() -> parser.parse("A[&k];"), NewickParseException.class).getTokenKind()).isEqualTo(TokenKind.CLOSEA);
	}

	@Test
	void rejectsEmptyAnnotationBlock() {
		assertThat(catchThrowableOfType(() -> parser.parse("A[&];"), NewickParseException.class).getTokenKind()).isEqualTo(TokenKind.CLOSEA);
	}

	@Test
	void escapedQuotesAreNotSupported() {
		assertThatThrownBy(() -> parser.parse("'it''s':1;")).isInstanceOf(NewickParseException.class);
	}

	@Test
	void propagatesLexicalErrors() {
		assertThatThrownBy(() -> parser.parse("(A, B);")).isInstanceOf(NewickLexException.class);
	}

	@Test
	void acceptsNegativeBranchLengthsByDefault() throws Exception {
		assertThat(parser.parse("A:-1;").getBranchLength()).isEqualTo(-1.0);
	}

	@Test
	void strictParserRejectsNegativeBranchLengths() {
		NewickParseException npe = catchThrowableOfType(() -> new NewickParser(true).parse("(A:1,B:-0.5);"), NewickParseException.class);

		assertThat(npe).hasMessageContaining("Negative branch length");
		assertThat(npe.getTokenValue()).isEqualTo("-0.5");
	}

	@Test
	void parsesNestingDeeperThanCallStack() throws Exception {
		int depth = 50000;
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < depth; i++)
			sb.append('(');
		sb.append('A');
		for (int i = 0; i < depth; i++)
			sb.append(')');
		Node node = parser.parse(sb.append(';').toString());

		int levels = 0;
		while (!node.isLeaf()) {
			node = node.getChildren().get(0);
			levels++;
		}
		assertThat(levels).isEqualTo(depth);
		assertThat(node.getLabel()).isEqualTo("A");
	}

	@Test
	void reportsUnclosedDeepSubtree() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < 5000; i++)
			sb.append('(');
		String newick = sb.append("A);").toString();

		NewickParseException e = catchThrowableOfType(() -> parser.parse(newick), NewickParseException.class);

		assertThat(e.getTokenKind()).isEqualTo(TokenKind.SEMI);
		assertThat(e.getTokenIndex()).isEqualTo(5002);
	}
}
