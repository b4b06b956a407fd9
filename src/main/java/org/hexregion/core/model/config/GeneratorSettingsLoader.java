package org.hexregion.core.model.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Локальные переопределения настроек генерации из local/region.local.properties.
 * Путь можно поменять через -Dregion.config.path или REGION_CONFIG_PATH.
 */
public final class GeneratorSettingsLoader {
    private static final Path DEFAULT_CONFIG_PATH = Paths.get("local", "region.local.properties");

    private GeneratorSettingsLoader() {
    }

    public static void apply(GeneratorSettings settings) {
        apply(settings, resolvePath());
    }

    public static void apply(GeneratorSettings settings, Path path) {
        if (!Files.exists(path)) {
            return;
        }

        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read local region config: " + path.toAbsolutePath(), e);
        }

        settings.name = GeneratorSettings.pick(props.getProperty("region.name"), settings.name);
        settings.width = GeneratorSettings.pickInt(settings.width, props.getProperty("region.width"));
        settings.height = GeneratorSettings.pickInt(settings.height, props.getProperty("region.height"));
        settings.seed = GeneratorSettings.pickInt(settings.seed, props.getProperty("region.seed"));
        settings.landFraction = GeneratorSettings.pickDouble(settings.landFraction,
                props.getProperty("region.landFraction"));
        settings.riverFraction = GeneratorSettings.pickDouble(settings.riverFraction,
                props.getProperty("region.riverFraction"));
        settings.landNoiseFrequency = GeneratorSettings.pickDouble(settings.landNoiseFrequency,
                props.getProperty("region.noise.land.frequency"));
        settings.moistureNoiseFrequency = GeneratorSettings.pickDouble(settings.moistureNoiseFrequency,
                props.getProperty("region.noise.moisture.frequency"));
        settings.settlementChance = GeneratorSettings.pickDouble(settings.settlementChance,
                props.getProperty("region.settlementChance"));
        settings.specialChance = GeneratorSettings.pickDouble(settings.specialChance,
                props.getProperty("region.specialChance"));
        settings.maxRoadDistance = GeneratorSettings.pickInt(settings.maxRoadDistance,
                props.getProperty("region.maxRoadDistance"));
        String validation = GeneratorSettings.pick(props.getProperty("region.validation"));
        if (validation != null) {
            settings.validation = Boolean.parseBoolean(validation);
        }
    }

    static Path resolvePath() {
        String override = GeneratorSettings.pick(
                System.getProperty("region.config.path"),
                System.getenv("REGION_CONFIG_PATH")
        );
        if (override == null) {
            return DEFAULT_CONFIG_PATH;
        }
        return Paths.get(override);
    }
}
