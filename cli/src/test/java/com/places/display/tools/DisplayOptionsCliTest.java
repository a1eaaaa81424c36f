package com.places.display.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DisplayOptionsCliTest {

    @TempDir Path tempDir;

    private Path attributes;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void writeAttributes() throws Exception {
        attributes = tempDir.resolve("attributes.properties");
        Files.writeString(
                attributes,
                String.join(
                        System.lineSeparator(),
                        "devicetracker_zone_name=home",
                        "street_number=1",
                        "street=Bridge Plaza North",
                        "city=Fort Lee",
                        ""),
                StandardCharsets.UTF_8);
    }

    @Test
    void rendersExpressionAgainstPropertiesFile() {
        int code = run(attributes.toString(), "zone_name[street_number, street, city]");

        assertEquals(DisplayOptionsCli.OK, code);
        assertEquals("1 Bridge Plaza North, Fort Lee", stdout());
    }

    @Test
    void inZoneFlagEnablesZoneOptions() {
        assertEquals(DisplayOptionsCli.OK, run("--in-zone", attributes.toString(), "zone_name[city]"));
        assertEquals("Home", stdout());
    }

    @Test
    void validateReportsProblemsAndSkipsRendering() {
        int code = run("--validate", attributes.toString(), "zone,[city,]");

        assertEquals(DisplayOptionsCli.INVALID, code);
        assertTrue(stdout().contains("bracket_syntax"), stdout());
        assertTrue(stdout().contains("comma_syntax"), stdout());
    }

    @Test
    void validExpressionRendersAfterValidation() {
        assertEquals(DisplayOptionsCli.OK, run("--validate", attributes.toString(), "street_number, street"));
        assertEquals("1 Bridge Plaza North", stdout());
    }

    @Test
    void warningsArePrintedButStillRender() {
        assertEquals(
                DisplayOptionsCli.OK, run("--validate", attributes.toString(), "street_number(1) x, city"));

        String[] lines = stdout().split("\\R");
        assertEquals(2, lines.length, stdout());
        assertTrue(lines[0].startsWith("WARNING trailing_text"), lines[0]);
        assertEquals("1", lines[1]);
    }

    @Test
    void usageErrors() {
        assertEquals(DisplayOptionsCli.USAGE, run("zone_name"));
        assertEquals(DisplayOptionsCli.USAGE, run("--bogus", attributes.toString(), "city"));
        assertEquals(DisplayOptionsCli.USAGE, run(tempDir.resolve("missing.properties").toString(), "city"));
        assertTrue(new String(err.toByteArray(), StandardCharsets.UTF_8).contains("Usage"));
    }

    private int run(String... args) {
        return DisplayOptionsCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8).strip();
    }
}
