package eu.virtualparadox.helpindex.tree.parser;

import eu.virtualparadox.helpindex.HelpCorpusFixture;
import eu.virtualparadox.helpindex.tree.HelpTree;
import eu.virtualparadox.helpindex.tree.model.ENodeKind;
import eu.virtualparadox.helpindex.tree.model.HelpNode;
import eu.virtualparadox.helpindex.util.Fingerprints;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructureParserTest {

    private final StructureParser parser = new StructureParser();

    private HelpTree parse(final String xml) {
        return parser.parse(xml.getBytes(StandardCharsets.UTF_8), "test.xml");
    }

    @Test
    @DisplayName("Sample corpus yields sections, pages, parents and stable identifiers")
    void parsesSampleCorpus() {
        final HelpTree tree = parse(HelpCorpusFixture.LONG_TAGS);

        assertThat(tree.size()).isEqualTo(5);
        assertThat(tree.pageCount()).isEqualTo(2);
        assertThat(tree.sectionCount()).isEqualTo(3);
        assertThat(tree.roots()).extracting(HelpNode::getId)
                .containsExactly("hardware_section", "motion_section");

        final HelpNode page = tree.getNode("mc_moveabs_page").orElseThrow();
        assertThat(page.getKind()).isEqualTo(ENodeKind.PAGE);
        assertThat(page.getTitle()).isEqualTo("MC_BR_MoveAbsolute");
        assertThat(page.getFile()).isEqualTo("motion/mapp_motion/mc_br_moveabsolute.html");
        assertThat(page.getParentId()).isEqualTo("mapp_motion_section");
        assertThat(page.getHelpIds()).containsExactly("20100");

        final HelpNode motion = tree.getNode("motion_section").orElseThrow();
        assertThat(motion.getHelpIds()).containsExactly("20000");
        assertThat(motion.getChildIds()).containsExactly("mapp_motion_section");
        assertThat(tree.findByHelpId("12345")).map(HelpNode::getId).contains("x20di9371_page");
    }

    @Test
    @DisplayName("Long and abbreviated spellings produce identical trees")
    void abbreviatedSpellingIsEquivalent() {
        final HelpTree longTree = parse(HelpCorpusFixture.LONG_TAGS);
        final HelpTree shortTree = parse(HelpCorpusFixture.ABBREVIATED_TAGS);

        assertThat(shortTree.size()).isEqualTo(longTree.size());
        for (final HelpNode expected : longTree.nodes()) {
            final HelpNode actual = shortTree.getNode(expected.getId()).orElseThrow();
            assertThat(actual.getTitle()).isEqualTo(expected.getTitle());
            assertThat(actual.getFile()).isEqualTo(expected.getFile());
            assertThat(actual.getKind()).isEqualTo(expected.getKind());
            assertThat(actual.getParentId()).isEqualTo(expected.getParentId());
            assertThat(actual.getChildIds()).isEqualTo(expected.getChildIds());
            assertThat(actual.getHelpIds()).isEqualTo(expected.getHelpIds());
        }
    }

    @Test
    @DisplayName("Title, file and identifiers are optional")
    void optionalFieldsMayBeMissing() {
        final HelpTree tree = parse("""
                <BrHelpContent>
                    <Section Id="bare">
                        <Page Id="p1"/>
                    </Section>
                </BrHelpContent>
                """);

        final HelpNode section = tree.getNode("bare").orElseThrow();
        assertThat(section.getTitle()).isEmpty();
        assertThat(section.getFile()).isNull();
        assertThat(section.hasFile()).isFalse();
        assertThat(section.getHelpIds()).isEmpty();
        assertThat(tree.getNode("p1").orElseThrow().getParentId()).isEqualTo("bare");
    }

    @Test
    @DisplayName("Missing ids are generated and duplicate ids are disambiguated")
    void missingAndDuplicateIds() {
        final HelpTree tree = parse("""
                <BrHelpContent>
                    <Section Text="Anonymous">
                        <Page Id="dup" Text="First"/>
                        <Page Id="dup" Text="Second"/>
                    </Section>
                </BrHelpContent>
                """);

        assertThat(tree.size()).isEqualTo(3);
        final HelpNode anonymous = tree.roots().get(0);
        assertThat(anonymous.getId()).isNotBlank();
        assertThat(anonymous.getTitle()).isEqualTo("Anonymous");
        assertThat(tree.getNode("dup").orElseThrow().getTitle()).isEqualTo("First");
        assertThat(anonymous.getChildIds()).hasSize(2).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("Node nested in a page is attached to the nearest enclosing section")
    void nodeInsidePageIsReattached() {
        final HelpTree tree = parse("""
                <BrHelpContent>
                    <Section Id="s">
                        <Page Id="p">
                            <Page Id="inner"/>
                        </Page>
                    </Section>
                    <Page Id="top">
                        <Section Id="orphan"/>
                    </Page>
                </BrHelpContent>
                """);

        assertThat(tree.getNode("inner").orElseThrow().getParentId()).isEqualTo("s");
        assertThat(tree.getNode("p").orElseThrow().getChildIds()).isEmpty();
        assertThat(tree.getNode("orphan").orElseThrow().isRoot()).isTrue();
        assertThat(tree.roots()).extracting(HelpNode::getId).containsExactly("s", "top", "orphan");
    }

    @Test
    @DisplayName("Unknown elements are transparent and stray identifiers are ignored")
    void unknownElementsAreTransparent() {
        final HelpTree tree = parse("""
                <BrHelpContent>
                    <HelpID Value="stray"/>
                    <Group>
                        <Section Id="s">
                            <Wrapper><Page Id="p"><Identifiers><HelpID Value="7"/></Identifiers></Page></Wrapper>
                        </Section>
                    </Group>
                </BrHelpContent>
                """);

        assertThat(tree.getNode("p").orElseThrow().getParentId()).isEqualTo("s");
        assertThat(tree.findByHelpId("7")).map(HelpNode::getId).contains("p");
        assertThat(tree.findByHelpId("stray")).isEmpty();
    }

    @Test
    @DisplayName("Syntax error reports line and column")
    void syntaxErrorCarriesLocation() {
        final String broken = "<BrHelpContent>\n  <Section Id=\"a\">\n  </Page>\n</BrHelpContent>";

        assertThatThrownBy(() -> parse(broken))
                .isInstanceOf(StructureParseException.class)
                .satisfies(e -> {
                    final StructureParseException pe = (StructureParseException) e;
                    assertThat(pe.getSource()).isEqualTo("test.xml");
                    assertThat(pe.getLine()).isEqualTo(3);
                    assertThat(pe.getColumn()).isPositive();
                });
    }

    @Test
    @DisplayName("Missing structure document raises a parse exception")
    void missingFile(@TempDir final Path dir) {
        assertThatThrownBy(() -> parser.parse(dir.resolve("absent.xml")))
                .isInstanceOf(StructureParseException.class);
    }

    @Test
    @DisplayName("Tree records the fingerprint and size of the parsed bytes")
    void recordsSourceFingerprint(@TempDir final Path dir) throws Exception {
        final Path source = HelpCorpusFixture.writeStructure(dir, HelpCorpusFixture.LONG_TAGS);

        final HelpTree tree = parser.parse(source);

        assertThat(tree.getSourceFingerprint()).isEqualTo(Fingerprints.sha256(source));
        assertThat(tree.getSourceSizeBytes()).isEqualTo(Files.size(source));
    }

    @Test
    @DisplayName("Tag spellings are matched case-insensitively only in their long form")
    void tagLookup() {
        assertThat(EStructureTag.of("section")).isEqualTo(EStructureTag.SECTION);
        assertThat(EStructureTag.of("P")).isEqualTo(EStructureTag.PAGE);
        assertThat(EStructureTag.of("p")).isEqualTo(EStructureTag.OTHER);
        assertThat(List.of(EStructureTag.of("H"), EStructureTag.of("HelpID")))
                .containsOnly(EStructureTag.HELP_ID);
    }
}
