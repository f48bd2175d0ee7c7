package eu.virtualparadox.helpindex.tree;

import eu.virtualparadox.helpindex.tree.model.ENodeKind;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class HelpTreeTest {

    @Test
    @DisplayName("Shared stable identifier keeps every node, first in document order wins single lookups")
    void sharedHelpIdRetainsAllNodes() {
        final HelpTreeBuilder builder = HelpTree.builder();
        builder.add("s", "Section", null, ENodeKind.SECTION, null);
        builder.add("a", "A", "a.html", ENodeKind.PAGE, "s");
        builder.add("b", "B", "b.html", ENodeKind.PAGE, "s");
        builder.addHelpId("a", "42");
        builder.addHelpId("b", " 42 ");
        builder.addHelpId("b", "43");

        final HelpTree tree = builder.build();

        assertThat(tree.findByHelpId("42")).map(HelpNode::getId).contains("a");
        assertThat(tree.findAllByHelpId("42")).extracting(HelpNode::getId).containsExactly("a", "b");
        assertThat(tree.findByHelpId("43")).map(HelpNode::getId).contains("b");
        assertThat(tree.helpIdCount()).isEqualTo(2);
        assertThat(tree.findByHelpId("nope")).isEmpty();
        assertThat(tree.findByHelpId(null)).isEmpty();
    }

    @Test
    @DisplayName("Unknown parent turns the node into a root")
    void unknownParentBecomesRoot() {
        final HelpTreeBuilder builder = HelpTree.builder();
        builder.add("a", "A", null, ENodeKind.PAGE, "ghost");

        final HelpTree tree = builder.build();

        final HelpNode node = tree.getNode("a").orElseThrow();
        assertThat(node.isRoot()).isTrue();
        assertThat(tree.roots()).containsExactly(node);
        assertThat(tree.parent(node)).isEmpty();
    }

    @Test
    @DisplayName("Children keep document order and resolve to their parent")
    void childrenAndParent() {
        final HelpTreeBuilder builder = HelpTree.builder();
        builder.add("s", "S", null, ENodeKind.SECTION, null);
        builder.add("c2", "Second", null, ENodeKind.PAGE, "s");
        builder.add("c1", "First", null, ENodeKind.PAGE, "s");

        final HelpTree tree = builder.build();
        final HelpNode section = tree.getNode("s").orElseThrow();

        assertThat(tree.children(section)).extracting(HelpNode::getId).containsExactly("c2", "c1");
        assertThat(tree.parent(tree.getNode("c1").orElseThrow())).contains(section);
        assertThat(tree.getNode(null)).isEmpty();
        assertThat(tree.getSourceFingerprint()).isEmpty();
    }

    @Test
    @DisplayName("Extracted text is cached on the node")
    void nodeTextCache() {
        final HelpNode node = new HelpNode("p", null, " ", ENodeKind.PAGE,
                List.of(), null, List.of());

        assertThat(node.getTitle()).isEmpty();
        assertThat(node.hasFile()).isFalse();
        assertThat(node.cachedText()).isEmpty();

        node.cacheText("body");

        assertThat(node.cachedText()).contains("body");
    }
}
