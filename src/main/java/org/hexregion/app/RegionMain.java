package org.hexregion.app;

import org.hexregion.core.io.LoadResult;
import org.hexregion.core.io.ProgressListener;
import org.hexregion.core.io.RegionJsonEncoder;
import org.hexregion.core.io.RegionSerializer;
import org.hexregion.core.io.RegionStore;
import org.hexregion.core.io.SaveResult;
import org.hexregion.core.model.RegionConnection;
import org.hexregion.core.model.RegionData;
import org.hexregion.core.model.RegionMetadata;
import org.hexregion.core.model.config.GeneratorSettings;
import org.hexregion.core.model.config.GeneratorSettingsLoader;
import org.hexregion.core.pathfinding.PathOptions;
import org.hexregion.core.pathfinding.PathResult;
import org.hexregion.core.pathfinding.Pathfinder;
import org.hexregion.core.pathfinding.UnitDomain;
import org.hexregion.core.service.RegionGenerationService;
import org.hexregion.core.topology.HexCoordinates;
import org.hexregion.core.util.CancellationToken;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Командная строка:
 * <pre>
 * generate &lt;out&gt; [--name N] [--width W] [--height H] [--seed S] [--land F] [--rivers F]
 * info &lt;file&gt;
 * list &lt;dir&gt;
 * path &lt;file&gt; &lt;x1&gt; &lt;z1&gt; &lt;x2&gt; &lt;z2&gt; [--domain land|naval|amphibious]
 * json &lt;file&gt;
 * </pre>
 */
public class RegionMain {

    public static void main(String[] args) {
        int code = run(args, System.out);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out) {
        List<String> positional = collectPositionalArgs(args);
        if (positional.isEmpty()) {
            printUsage(out);
            return 2;
        }
        String command = positional.get(0);
        try {
            return switch (command) {
                case "generate" -> generate(positional, args, out);
                case "info" -> info(positional, out);
                case "list" -> list(positional, out);
                case "path" -> path(positional, args, out);
                case "json" -> json(positional, out);
                default -> {
                    out.println("Unknown command: " + command);
                    printUsage(out);
                    yield 2;
                }
            };
        } catch (IllegalArgumentException e) {
            out.println("[ERROR] " + e.getMessage());
            return 2;
        }
    }

    private static int generate(List<String> positional, String[] args, PrintStream out) {
        requireArgs(positional, 2, "generate <out>");
        Path target = Paths.get(positional.get(1));

        GeneratorSettings settings = buildSettings(args);
        out.println("[GENERATE] " + settings);

        try (RegionGenerationService service = new RegionGenerationService()) {
            RegionData region = service.generate(settings, CancellationToken.none());
            SaveResult saved = new RegionSerializer().save(region, target, consoleProgress(out),
                    CancellationToken.none());
            if (!saved.isSuccess()) {
                out.println("[ERROR] " + saved.status() + ": " + saved.message());
                return 1;
            }
            out.println("[GENERATE] saved " + saved.bytesWritten() + " bytes to " + saved.path());
            return 0;
        }
    }

    private static int info(List<String> positional, PrintStream out) {
        requireArgs(positional, 2, "info <file>");
        LoadResult<RegionMetadata> r = new RegionSerializer().loadMetadata(Paths.get(positional.get(1)));
        if (!r.isSuccess()) {
            out.println("[ERROR] " + r.status() + ": " + r.message());
            return 1;
        }
        RegionMetadata m = r.value();
        out.println("id:        " + m.id());
        out.println("name:      " + m.name());
        out.println("size:      " + m.width() + "x" + m.height());
        out.println("seed:      " + m.seed());
        out.println("generated: " + m.generatedAt());
        out.println("version:   " + m.formatVersion());
        for (RegionConnection c : m.connections()) {
            out.println(String.format(Locale.ROOT, "  -> %s (%s) ports %d->%d, %.1f min, danger %.2f",
                    c.targetRegionName(), c.targetRegionId(), c.departurePortIndex(), c.arrivalPortIndex(),
                    c.travelTimeMinutes(), c.dangerLevel()));
        }
        return 0;
    }

    private static int list(List<String> positional, PrintStream out) {
        requireArgs(positional, 2, "list <dir>");
        RegionStore store = new RegionStore(Paths.get(positional.get(1)), new RegionSerializer());
        List<RegionMetadata> catalog = store.catalog();
        for (RegionMetadata m : catalog) {
            out.println(m.sourcePath().getFileName() + "  " + m.name() + "  " + m.width() + "x" + m.height()
                    + "  seed=" + m.seed());
        }
        out.println("[LIST] " + catalog.size() + " region(s)");
        return 0;
    }

    private static int path(List<String> positional, String[] args, PrintStream out) {
        requireArgs(positional, 6, "path <file> <x1> <z1> <x2> <z2>");
        LoadResult<RegionData> r = new RegionSerializer().load(Paths.get(positional.get(1)));
        if (!r.isSuccess()) {
            out.println("[ERROR] " + r.status() + ": " + r.message());
            return 1;
        }
        HexCoordinates from = HexCoordinates.fromOffset(parseInt(positional.get(2)), parseInt(positional.get(3)));
        HexCoordinates to = HexCoordinates.fromOffset(parseInt(positional.get(4)), parseInt(positional.get(5)));
        String domainArg = findOptionValue(args, "--domain");
        UnitDomain domain = domainArg == null ? UnitDomain.LAND : parseDomain(domainArg);

        PathResult result = new Pathfinder(r.value()).findPath(from, to, PathOptions.forDomain(domain));
        if (!result.reachable()) {
            out.println("[PATH] not reachable");
            return 1;
        }
        out.println(String.format(Locale.ROOT, "[PATH] cost=%.2f steps=%d", result.cost(), result.length() - 1));
        StringBuilder sb = new StringBuilder();
        for (HexCoordinates c : result.path()) {
            if (sb.length() > 0) sb.append(" -> ");
            sb.append(c.offsetX()).append(',').append(c.offsetZ());
        }
        out.println(sb);
        return 0;
    }

    private static int json(List<String> positional, PrintStream out) {
        requireArgs(positional, 2, "json <file>");
        LoadResult<RegionData> r = new RegionSerializer().load(Paths.get(positional.get(1)));
        if (!r.isSuccess()) {
            out.println("[ERROR] " + r.status() + ": " + r.message());
            return 1;
        }
        out.println(RegionJsonEncoder.encodeRegion(r.value()));
        return 0;
    }

    static GeneratorSettings buildSettings(String[] args) {
        GeneratorSettings settings = new GeneratorSettings(0);
        GeneratorSettingsLoader.apply(settings);
        settings.applyOverridesFromSystem();

        String v;
        if ((v = findOptionValue(args, "--name")) != null) settings.name = v;
        if ((v = findOptionValue(args, "--width")) != null) settings.width = parseInt(v);
        if ((v = findOptionValue(args, "--height")) != null) settings.height = parseInt(v);
        if ((v = findOptionValue(args, "--seed")) != null) settings.seed = parseInt(v);
        if ((v = findOptionValue(args, "--land")) != null) settings.landFraction = parseDouble(v);
        if ((v = findOptionValue(args, "--rivers")) != null) settings.riverFraction = parseDouble(v);
        return settings;
    }

    private static ProgressListener consoleProgress(PrintStream out) {
        return (stage, fraction) -> out.println(String.format(Locale.ROOT, "[SAVE] %-18s %5.1f%%",
                stage, fraction * 100.0));
    }

    private static UnitDomain parseDomain(String v) {
        try {
            return UnitDomain.valueOf(v.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown domain: " + v + " (land|naval|amphibious)", e);
        }
    }

    private static int parseInt(String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an integer: " + v, e);
        }
    }

    private static double parseDouble(String v) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + v, e);
        }
    }

    private static void requireArgs(List<String> positional, int count, String usage) {
        if (positional.size() < count) {
            throw new IllegalArgumentException("Usage: " + usage);
        }
    }

    private static String findOptionValue(String[] args, String option) {
        for (int i = 0; i < args.length - 1; i++) {
            if (option.equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static List<String> collectPositionalArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String token = args[i];
            if (isOptionWithValue(token)) {
                i++;
                continue;
            }
            if (token.startsWith("--")) {
                continue;
            }
            out.add(token);
        }
        return out;
    }

    private static boolean isOptionWithValue(String token) {
        return "--name".equals(token)
                || "--width".equals(token)
                || "--height".equals(token)
                || "--seed".equals(token)
                || "--land".equals(token)
                || "--rivers".equals(token)
                || "--domain".equals(token);
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage:");
        out.println("  generate <out> [--name N] [--width W] [--height H] [--seed S] [--land F] [--rivers F]");
        out.println("  info <file>");
        out.println("  list <dir>");
        out.println("  path <file> <x1> <z1> <x2> <z2> [--domain land|naval|amphibious]");
        out.println("  json <file>");
    }
}
