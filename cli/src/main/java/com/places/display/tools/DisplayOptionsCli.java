package com.places.display.tools;

import com.places.display.DisplayOptionsEngine;
import com.places.display.Version;
import com.places.display.attributes.DisplayOptionNames;
import com.places.display.attributes.MapAttributeStore;
import com.places.display.attributes.ZoneChecker;
import com.places.display.validation.DisplayMessage;
import com.places.display.validation.DisplayOptionsValidator;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Renders a display options expression against attributes read from a properties file, or checks
 * the expression the way the configuration screen does when {@code --validate} is given.
 */
public final class DisplayOptionsCli {
    static final int OK = 0;
    static final int USAGE = 1;
    static final int INVALID = 2;

    private static final String USAGE_TEXT =
            "Usage: DisplayOptionsCli [--in-zone] [--validate] <attributes.properties> <expression>";

    private DisplayOptionsCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        boolean inZone = false;
        boolean validate = false;
        List<String> positional = new ArrayList<>();
        for (String arg : args) {
            switch (arg) {
                case "--in-zone" -> inZone = true;
                case "--validate" -> validate = true;
                case "--version" -> {
                    out.println("places-display " + Version.RUNTIME);
                    return OK;
                }
                default -> {
                    if (arg.startsWith("--")) {
                        err.println("Unknown option: " + arg);
                        err.println(USAGE_TEXT);
                        return USAGE;
                    }
                    positional.add(arg);
                }
            }
        }
        if (positional.size() != 2) {
            err.println(USAGE_TEXT);
            return USAGE;
        }

        Path attributesFile = Path.of(positional.get(0)).toAbsolutePath().normalize();
        String expression = positional.get(1);
        if (validate) {
            List<DisplayMessage> messages =
                    DisplayOptionsValidator.defaultRules(DisplayOptionNames.defaults()).validate(expression);
            boolean invalid = false;
            for (DisplayMessage message : messages) {
                out.println(message);
                invalid |= message.getLevel() == DisplayMessage.Level.ERROR;
            }
            if (invalid) {
                return INVALID;
            }
        }

        MapAttributeStore attributes;
        try {
            attributes = MapAttributeStore.fromProperties(loadProperties(attributesFile));
        } catch (IOException ex) {
            err.println("Cannot read attributes from " + attributesFile + ": " + ex.getMessage());
            return USAGE;
        }
        out.println(new DisplayOptionsEngine().evaluate(expression, attributes, ZoneChecker.fixed(inZone)));
        return OK;
    }

    private static Properties loadProperties(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("not a file");
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        }
        return properties;
    }
}
