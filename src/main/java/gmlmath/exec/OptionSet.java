package gmlmath.exec;

import gmlmath.hir.PrintTools;

import java.util.Map;
import java.util.TreeMap;

/**
* Named integer options that steer the normalization passes. Every option has
* a default value, an upper bound and a usage text. The set created by the
* public constructor holds all options known to the normalizer; values are
* changed with {@link #setValue} or with {@code name=value} strings.
*/
public class OptionSet {

    public static final int UTILITY = 1;
    public static final int TRANSFORM = 2;

    /** Status output level; higher values print more. */
    public static final String VERBOSITY = "verbosity";

    /** Rewrites division by a constant as multiplication by its inverse. */
    public static final String CONVERT_DIVISION = "convert-division";

    /** Keeps the hand-written form of condensed declarations as comments. */
    public static final String RECORD_ORIGINAL = "record-original";

    /** Folds a declaration and a following lengthdir_x half-difference. */
    public static final String MERGE_LENGTHDIR = "merge-lengthdir";

    /** Removes parentheses left around identity-derived operands. */
    public static final String CLEANUP_PARENTHESES = "cleanup-parentheses";

    /** Multiplies adjacent numeric literals of a product. */
    public static final String CONDENSE_SCALARS = "condense-scalars";

    /** Folds zero numerators of divisions. */
    public static final String ZERO_DIVISION = "zero-division";

    private static class OptionRecord {
        int option_type;
        int value;
        int max_value;
        String arg;
        String usage;

        OptionRecord(int type, int value, int max_value, String arg,
                String usage) {
            this.option_type = type;
            this.value = value;
            this.max_value = max_value;
            this.arg = arg;
            this.usage = usage;
        }
    }

    private TreeMap<String, OptionRecord> name_to_record;

    /** Creates the option set with every option at its default value. */
    public OptionSet() {
        name_to_record = new TreeMap<String, OptionRecord>();
        add(UTILITY, VERBOSITY, 0, 4, "N",
                "Degree of status messages (0-4) that you wish to see (default is 0)");
        add(TRANSFORM, CONVERT_DIVISION, 0, 1, "0|1",
                "Replace division by a numeric constant with multiplication by its\n"
                + "inverse, e.g. x / 4 becomes x * 0.25 (default is 0)");
        add(TRANSFORM, RECORD_ORIGINAL, 0, 1, "0|1",
                "Keep the hand-written initializer of a condensed declaration as an\n"
                + "\"// original:\" line above it (default is 0)");
        add(TRANSFORM, MERGE_LENGTHDIR, 1, 1, "0|1",
                "Fold \"var s = e; s = s - s/2 - lengthdir_x(s/2, a);\" into a single\n"
                + "declaration (default is 1)");
        add(TRANSFORM, CLEANUP_PARENTHESES, 1, 1, "0|1",
                "Remove parentheses left around operands of removed identities\n"
                + "(default is 1)");
        add(TRANSFORM, CONDENSE_SCALARS, 1, 1, "0|1",
                "Multiply adjacent numeric literals of a product (default is 1)");
        add(TRANSFORM, ZERO_DIVISION, 1, 1, "0|1",
                "Replace 0 / x with 0 when x is not a constant zero (default is 1)");
    }

    /**
    * Registers an option.
    *
    * @param type the option group, {@link #UTILITY} or {@link #TRANSFORM}.
    * @param name the option name.
    * @param value the default value.
    * @param max_value the largest accepted value.
    * @param arg the argument description shown in the usage text.
    * @param usage the usage text.
    */
    public void add(int type, String name, int value, int max_value,
            String arg, String usage) {
        name_to_record.put(name,
                new OptionRecord(type, value, max_value, arg, usage));
    }

    public boolean contains(String name) {
        return name_to_record.containsKey(name);
    }

    /**
    * Returns the value of the named option.
    *
    * @param name the option name.
    * @return the current value.
    * @throws IllegalArgumentException if the option is unknown.
    */
    public int getValue(String name) {
        return getRecord(name).value;
    }

    /**
    * Checks if the named option has a non-zero value.
    *
    * @param name the option name.
    * @return true if the option is turned on.
    */
    public boolean isEnabled(String name) {
        return getValue(name) != 0;
    }

    /**
    * Sets the value of the named option. Setting the verbosity also sets the
    * level used by {@link PrintTools}.
    *
    * @param name the option name.
    * @param value the new value.
    * @throws IllegalArgumentException if the option is unknown or the value
    *   is out of range.
    */
    public void setValue(String name, int value) {
        OptionRecord record = getRecord(name);
        if (value < 0 || value > record.max_value) {
            throw new IllegalArgumentException("value " + value
                    + " out of range for option " + name
                    + " (0-" + record.max_value + ")");
        }
        record.value = value;
        if (VERBOSITY.equals(name)) {
            PrintTools.setVerbosity(value);
        }
    }

    /**
    * Sets an option from a {@code name=value} string. A bare name turns the
    * option on.
    *
    * @param setting the option setting; a leading dash is ignored.
    * @throws IllegalArgumentException if the setting is malformed, the option
    *   is unknown or the value is out of range.
    */
    public void parse(String setting) {
        String s = setting.trim();
        if (s.startsWith("-")) {
            s = s.substring(1);
        }
        int eq = s.indexOf('=');
        String name = (eq < 0) ? s : s.substring(0, eq).trim();
        int value = 1;
        if (eq >= 0) {
            String text = s.substring(eq + 1).trim();
            try {
                value = Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid value \"" + text
                        + "\" for option " + name, e);
            }
        }
        setValue(name, value);
    }

    /** Returns the usage text of all options grouped by type. */
    public String getUsage() {
        StringBuilder sb = new StringBuilder(2000);
        String sep = PrintTools.line_sep;
        appendRule(sb, sep);
        sb.append("UTILITY").append(sep);
        appendRule(sb, sep);
        sb.append(getUsage(UTILITY));
        appendRule(sb, sep);
        sb.append("TRANSFORM").append(sep);
        appendRule(sb, sep);
        sb.append(getUsage(TRANSFORM));
        return sb.toString();
    }

    /**
    * Returns the usage text of the options of one type.
    *
    * @param type the option group.
    */
    public String getUsage(int type) {
        StringBuilder sb = new StringBuilder(1000);
        for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
            OptionRecord record = entry.getValue();
            if (record.option_type == type) {
                sb.append("-").append(entry.getKey());
                if (record.arg != null) {
                    sb.append("=").append(record.arg);
                }
                sb.append("\n    ");
                sb.append(record.usage.replace("\n", "\n    "));
                sb.append("\n\n");
            }
        }
        return sb.toString();
    }

    /**
    * Dumps all options with their usage text as comment lines followed by a
    * {@code name=value} line holding the current value.
    */
    public String dumpOptions() {
        StringBuilder sb = new StringBuilder(2000);
        for (Map.Entry<String, OptionRecord> entry : name_to_record.entrySet()) {
            OptionRecord record = entry.getValue();
            sb.append("#Option: ").append(entry.getKey()).append("\n#");
            sb.append(entry.getKey());
            if (record.arg != null) {
                sb.append("=").append(record.arg);
            }
            sb.append("\n#").append(record.usage.replace("\n", "\n#"));
            sb.append("\n").append(entry.getKey()).append("=");
            sb.append(record.value).append("\n");
        }
        return sb.toString();
    }

    private OptionRecord getRecord(String name) {
        OptionRecord record = name_to_record.get(name);
        if (record == null) {
            throw new IllegalArgumentException("unknown option " + name);
        }
        return record;
    }

    private static void appendRule(StringBuilder sb, String sep) {
        for (int i = 0; i < 80; i++) {
            sb.append("-");
        }
        sb.append(sep);
    }

}
