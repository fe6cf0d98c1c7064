package de.mirkosertic.mcp.controlmapper.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("ControlCatalogLoader Tests")
class ControlCatalogLoaderTest {

    @TempDir
    Path tempDir;

    private final ControlCatalogLoader loader = ControlCatalogLoader.withDefaultColumns();

    private ControlCatalog load(final String csv) throws IOException {
        return loader.load(new StringReader(csv), "test.csv");
    }

    @Test
    @DisplayName("Should load controls in file order with extra columns as attributes")
    void shouldLoadControlsInOrder() throws IOException {
        final ControlCatalog catalog = load("""
                id,description,family
                10,Network firewall access control,SC
                2,"Encryption at rest, and in transit",SC
                """);

        assertThat(catalog.size()).isEqualTo(2);
        assertThat(catalog.get(0).id()).isEqualTo("10");
        assertThat(catalog.get(1).description()).isEqualTo("Encryption at rest, and in transit");
        assertThat(catalog.get(0).attributes()).containsEntry("family", "SC");
        assertThat(catalog.source()).isEqualTo("test.csv");
    }

    @Test
    @DisplayName("Should match column names case-insensitively and ignore a byte order mark")
    void shouldMatchColumnsCaseInsensitively() throws IOException {
        final String csv = "\uFEFFControl ID , Description\nAC-1,Access control policy\n";

        final ControlCatalog catalog = new ControlCatalogLoader("control id", "DESCRIPTION")
                .load(new StringReader(csv), "bom.csv");

        assertThat(catalog.find("AC-1"))
                .hasValueSatisfying(control -> assertThat(control.description()).isEqualTo("Access control policy"));
    }

    @Test
    @DisplayName("Should find the default id column behind a byte order mark")
    void shouldStripByteOrderMark() throws IOException {
        final ControlCatalog catalog = load("\uFEFFid,description\n1,Firewall\n");

        assertThat(catalog.contains("1")).isTrue();
    }

    @Test
    @DisplayName("Should skip blank lines and trim cells")
    void shouldSkipBlankLines() throws IOException {
        final ControlCatalog catalog = load("id,description\n\n  1 ,  Backup procedures  \n\n2,Audit logging\n");

        assertThat(catalog.controls()).extracting(ControlRecord::id).containsExactly("1", "2");
        assertThat(catalog.get(0).description()).isEqualTo("Backup procedures");
    }

    @Test
    @DisplayName("Should keep the last definition of a duplicated id at its first position")
    void shouldResolveDuplicatesLastWins() throws IOException {
        final ControlCatalog catalog = load("""
                id,description
                1,first definition
                2,second control
                1,redefined control
                """);

        assertThat(catalog.controls()).extracting(ControlRecord::id).containsExactly("1", "2");
        assertThat(catalog.get(0).description()).isEqualTo("redefined control");
        assertThat(catalog.positionOf("1")).isZero();
    }

    @Test
    @DisplayName("Should name the missing column and the header found")
    void shouldFailOnMissingColumn() {
        assertThatThrownBy(() -> load("id,text\n1,firewall\n"))
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("'description'")
                .hasMessageContaining("[id, text]");
    }

    @Test
    @DisplayName("Should report the record of a blank control id")
    void shouldFailOnBlankId() {
        assertThatThrownBy(() -> load("id,description\n1,firewall\n ,encryption\n"))
                .isInstanceOfSatisfying(CatalogFormatException.class, e -> {
                    assertThat(e.getRecordNumber()).isEqualTo(3);
                    assertThat(e.getColumn()).isEqualTo("id");
                })
                .hasMessageContaining("Record 3");
    }

    @Test
    @DisplayName("Should count a quoted multi-line cell as a single record")
    void shouldNumberRecordsNotLines() {
        // given: the second record spans two physical lines, the blank id sits on line 4
        final String csv = "id,description\n1,\"network\nfirewall\"\n ,encryption\n";

        // when / then
        assertThatThrownBy(() -> load(csv))
                .isInstanceOfSatisfying(CatalogFormatException.class,
                        e -> assertThat(e.getRecordNumber()).isEqualTo(3))
                .hasMessageContaining("Record 3 of test.csv");
    }

    @Test
    @DisplayName("Should report records without a description cell")
    void shouldFailOnMissingCell() {
        assertThatThrownBy(() -> load("id,description\n1\n"))
                .isInstanceOfSatisfying(CatalogFormatException.class,
                        e -> assertThat(e.getRecordNumber()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should reject empty sources and header-only catalogs")
    void shouldFailOnEmptyCatalog() {
        assertThatThrownBy(() -> load(""))
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("is empty");
        assertThatThrownBy(() -> load("id,description\n\n"))
                .isInstanceOf(CatalogFormatException.class)
                .hasMessageContaining("contains no controls");
    }

    @Test
    @DisplayName("Should fail with NoSuchFileException for a missing file")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("missing.csv")))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    @DisplayName("Should load a catalog file from disk")
    void shouldLoadFromFile() throws IOException, URISyntaxException {
        final Path file = Paths.get(getClass().getClassLoader().getResource("controls.csv").toURI());

        final ControlCatalog catalog = loader.load(file);

        assertThat(catalog.size()).isEqualTo(5);
        assertThat(catalog.find("4")).hasValueSatisfying(control -> {
            assertThat(control.description()).startsWith("Multi-factor authentication");
            assertThat(control.attributes()).containsExactly(entry("family", "IA"), entry("baseline", "high"));
        });
    }

    @Test
    @DisplayName("Should use configured column names")
    void shouldUseConfiguredColumns() throws IOException {
        final Path file = tempDir.resolve("catalog.csv");
        Files.writeString(file, "ctrl,text,id\nAC-2,Account management,ignored\n");

        final ControlCatalog catalog = new ControlCatalogLoader("ctrl", "text").load(file);

        assertThat(catalog.get(0).id()).isEqualTo("AC-2");
        assertThat(catalog.get(0).attributes()).containsEntry("id", "ignored");
    }

    @Test
    @DisplayName("Should reject identical id and description columns")
    void shouldRejectIdenticalColumns() {
        assertThatThrownBy(() -> new ControlCatalogLoader("id", "ID"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
