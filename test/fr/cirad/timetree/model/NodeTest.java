package fr.cirad.timetree.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class NodeTest {

	@Test
	void addChildWiresParentBackReference() {
		Node parent = new Node("P");
		Node child = new Node("C", 2.5);
		parent.addChild(child);

		assertThat(child.getParent()).isSameAs(parent);
		assertThat(parent.getChildren()).containsExactly(child);
		assertThat(parent.isRoot()).isTrue();
		assertThat(parent.isLeaf()).isFalse();
		assertThat(child.isRoot()).isFalse();
		assertThat(child.isLeaf()).isTrue();
	}

	@Test
	void refusesNodeAlreadyAttachedElsewhere() {
		Node first = new Node("1");
		Node second = new Node("2");
		Node child = new Node("C");
		first.addChild(child);

		assertThatThrownBy(() -> second.addChild(child))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("already attached");
		assertThat(second.getChildren()).isEmpty();
	}

	@Test
	void refusesCycles() {
		Node root = new Node("R");
		Node child = new Node("C");
		root.addChild(child);

		assertThatThrownBy(() -> child.addChild(root)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> root.addChild(root)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> root.addChild(null)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void exposesReadOnlyChildrenAndAnnotations() {
		Node node = new Node();
		node.putAnnotation("k", "v");

		assertThatThrownBy(() -> node.getChildren().add(new Node())).isInstanceOf(UnsupportedOperationException.class);
		assertThatThrownBy(() -> node.getAnnotations().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void listsCladeInPreorderAndLeavesLeftToRight() {
		Node root = new Node("R");
		Node x = new Node("X");
		Node a = new Node("A");
		Node b = new Node("B");
		Node c = new Node("C");
		root.addChild(x);
		x.addChild(a);
		x.addChild(b);
		root.addChild(c);

		assertThat(root.getClade()).containsExactly(root, x, a, b, c);
		assertThat(root.getLeaves()).containsExactly(a, b, c);
		assertThat(x.getClade()).containsExactly(x, a, b);
		assertThat(a.getLeaves()).containsExactly(a);
	}

	@Test
	void computesTimesFromOffset() {
		Node root = new Node("R", 0.5);
		Node child = new Node("C", 1.5);
		root.addChild(child);

		root.computeTimes(0.0);

		assertThat(root.getTime()).isEqualTo(0.5);
		assertThat(child.getTime()).isEqualTo(2.0);
	}

	@Test
	void derivedValuesAreUnsetOnNewNodes() {
		Node node = new Node();

		assertThat(node.getBranchLength()).isEqualTo(Node.DEFAULT_BRANCH_LENGTH);
		assertThat(node.getTime()).isNaN();
		assertThat(node.getHeight()).isNaN();
		assertThat(node.getLabel()).isNull();
	}
}
