package eu.virtualparadox.helpindex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Sample help corpus: two top-level sections, one nested section and two pages,
 * written with either tag spelling.
 */
public final class HelpCorpusFixture {

    public static final String SOURCE_FILE = "brhelpcontent.xml";

    public static final String LONG_TAGS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <BrHelpContent>
                <Section Id="hardware_section" Text="Hardware" File="index.html">
                    <Page Id="x20di9371_page" Text="X20DI9371" File="hardware/x20di9371.html">
                        <Identifiers>
                            <HelpID Value="12345"/>
                        </Identifiers>
                    </Page>
                </Section>
                <Section Id="motion_section" Text="Motion" File="motion/overview.html">
                    <Identifiers>
                        <HelpID Value="20000"/>
                    </Identifiers>
                    <Section Id="mapp_motion_section" Text="mapp Motion" File="motion/overview.html">
                        <Page Id="mc_moveabs_page" Text="MC_BR_MoveAbsolute" File="motion/mapp_motion/mc_br_moveabsolute.html">
                            <Identifiers>
                                <HelpID Value="20100"/>
                            </Identifiers>
                        </Page>
                    </Section>
                </Section>
            </BrHelpContent>
            """;

    public static final String ABBREVIATED_TAGS = """
            <?xml version="1.0" encoding="UTF-8"?>
            <BrHelpContent>
                <S Id="hardware_section" t="Hardware" p="index.html">
                    <P Id="x20di9371_page" t="X20DI9371" p="hardware/x20di9371.html">
                        <I>
                            <H v="12345"/>
                        </I>
                    </P>
                </S>
                <S Id="motion_section" t="Motion" p="motion/overview.html">
                    <I>
                        <H v="20000"/>
                    </I>
                    <S Id="mapp_motion_section" t="mapp Motion" p="motion/overview.html">
                        <P Id="mc_moveabs_page" t="MC_BR_MoveAbsolute" p="motion/mapp_motion/mc_br_moveabsolute.html">
                            <I>
                                <H v="20100"/>
                            </I>
                        </P>
                    </S>
                </S>
            </BrHelpContent>
            """;

    private HelpCorpusFixture() {
    }

    /**
     * Writes the HTML pages of the sample corpus and the given structure document under {@code root}.
     *
     * @return path of the structure document
     */
    public static Path writeCorpus(final Path root, final String structure) throws IOException {
        writeHtml(root, "index.html", "Index", "<h1>Welcome</h1><p>This is the index page.</p>");
        writeHtml(root, "hardware/x20di9371.html", "X20DI9371",
                "<h1>X20DI9371</h1><p>Digital input module with 12 channels.</p>");
        writeHtml(root, "motion/overview.html", "Motion Overview",
                "<h1>Motion</h1><p>Motion control system overview.</p>");
        writeHtml(root, "motion/mapp_motion/mc_br_moveabsolute.html", "MC_BR_MoveAbsolute",
                "<h1>MC_BR_MoveAbsolute</h1><p>Moves axis to absolute position.</p>");
        return writeStructure(root, structure);
    }

    public static Path writeStructure(final Path root, final String structure) throws IOException {
        Files.createDirectories(root);
        final Path source = root.resolve(SOURCE_FILE);
        Files.writeString(source, structure, StandardCharsets.UTF_8);
        return source;
    }

    public static Path writeHtml(final Path root, final String file, final String title, final String body)
            throws IOException {
        final Path path = root.resolve(file);
        Files.createDirectories(path.getParent());
        Files.writeString(path,
                "<html><head><title>" + title + "</title></head><body>" + body + "</body></html>",
                StandardCharsets.UTF_8);
        return path;
    }
}
