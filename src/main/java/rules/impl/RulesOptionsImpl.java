package rules.impl;

import static rules.constants.RulesConstants.OPT_PARALLEL_ATTACK_SCAN;
import static rules.constants.RulesConstants.OPT_STRICT_CASTLING;

import rules.contracts.RulesOptions;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements the RulesOptions contract to manage engine settings.
 */
public class RulesOptionsImpl implements RulesOptions {

    private static final Logger LOG = LoggerFactory.getLogger(RulesOptionsImpl.class);

    private volatile boolean strictCastling = true;
    private volatile boolean parallelAttackScan = false;

    private record RulesOption(String type, String defaultValue, Consumer<String> onSet) {
        String describe(String name) {
            return "option name " + name + " type " + type + " default " + defaultValue;
        }
    }

    private final Map<String, RulesOption> options = new LinkedHashMap<>();

    public RulesOptionsImpl() {
        options.put(OPT_STRICT_CASTLING, new RulesOption(
                "check", "true", v -> strictCastling = parseCheck(v)));
        options.put(OPT_PARALLEL_ATTACK_SCAN, new RulesOption(
                "check", "false", v -> parallelAttackScan = parseCheck(v)));
    }

    @Override
    public boolean setOption(String line) {
        String[] parts = line.trim().split("\\s+");
        int nameIdx = indexOf(parts, "name");
        int valueIdx = indexOf(parts, "value");
        if (nameIdx < 0 || valueIdx < 0 || valueIdx <= nameIdx + 1 || valueIdx == parts.length - 1) {
            LOG.warn("Ignoring malformed option line: {}", line);
            return false;
        }

        String name = String.join(" ", List.of(parts).subList(nameIdx + 1, valueIdx));
        String value = String.join(" ", List.of(parts).subList(valueIdx + 1, parts.length));

        RulesOption opt = findOption(name);
        if (opt == null) {
            LOG.warn("Unknown option: {}", name);
            return false;
        }
        try {
            opt.onSet().accept(value);
        } catch (IllegalArgumentException e) {
            LOG.warn("Invalid value '{}' for option {}: {}", value, name, e.getMessage());
            return false;
        }
        LOG.debug("Option {} set to {}", name, value);
        return true;
    }

    @Override
    public List<String> describeOptions() {
        List<String> lines = new ArrayList<>(options.size());
        options.forEach((name, opt) -> lines.add(opt.describe(name)));
        return lines;
    }

    @Override
    public String getOptionValue(String name) {
        if (OPT_STRICT_CASTLING.equalsIgnoreCase(name)) return Boolean.toString(strictCastling);
        if (OPT_PARALLEL_ATTACK_SCAN.equalsIgnoreCase(name)) return Boolean.toString(parallelAttackScan);
        return null;
    }

    @Override
    public boolean strictCastling() {
        return strictCastling;
    }

    @Override
    public boolean parallelAttackScan() {
        return parallelAttackScan;
    }

    /* option names are case-insensitive, as GUIs are inconsistent about them */
    private RulesOption findOption(String name) {
        for (Map.Entry<String, RulesOption> e : options.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    private static boolean parseCheck(String v) {
        return switch (v.toLowerCase(Locale.ROOT)) {
            case "true" -> true;
            case "false" -> false;
            default -> throw new IllegalArgumentException("expected true or false");
        };
    }

    private static int indexOf(String[] parts, String token) {
        for (int i = 0; i < parts.length; i++) if (parts[i].equalsIgnoreCase(token)) return i;
        return -1;
    }
}
