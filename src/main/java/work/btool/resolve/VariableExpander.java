package work.btool.resolve;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import work.btool.model.Setting;
import work.btool.model.VariableDef;
import work.btool.shared.ConfigurationException;
import work.btool.shared.Diagnostic;

/**
 * Expands the variables of a setting into the family of concrete settings, one per element of the
 * cross product of the variables' values. The family is produced lazily and may be iterated any
 * number of times; the last variable varies fastest.
 */
public final class VariableExpander {
    /** Upper bound on the number of settings one declaration may expand to. */
    public static final int MAX_FAMILY_SIZE = 100_000;

    private VariableExpander() {}

    /**
     * Returns the concrete settings of {@code setting}; a setting without variables is returned as
     * is. Value specs are validated eagerly so a broken variable fails here, not mid-iteration.
     */
    public static Iterable<Setting> expand(Setting setting) {
        if (!setting.hasVariables()) {
            return List.of(setting);
        }
        var axes = new ArrayList<List<String>>();
        long size = 1;
        for (VariableDef variable : setting.variables()) {
            var values = values(variable.values(), setting.name());
            size *= values.size();
            if (size > MAX_FAMILY_SIZE) {
                throw tooLarge(setting.name());
            }
            axes.add(values);
        }
        var frozen = List.copyOf(axes);
        return () -> new FamilyIterator(setting, frozen);
    }

    static List<String> values(VariableDef.ValueSpec spec, String owner) {
        if (spec instanceof VariableDef.Range range) {
            return rangeValues(range, owner);
        }
        if (spec instanceof VariableDef.Pool pool) {
            var items = pool.items().stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
            if (items.isEmpty()) {
                throw ConfigurationException.structural("setting '" + owner + "' declares a variable with an empty value pool");
            }
            return items;
        }
        throw new IllegalArgumentException("Unsupported value spec: " + spec);
    }

    private static List<String> rangeValues(VariableDef.Range range, String owner) {
        BigDecimal start = decimal(range.start(), range, owner);
        BigDecimal end = decimal(range.end(), range, owner);
        BigDecimal step = decimal(range.step(), range, owner);
        if (step.signum() <= 0) {
            throw ConfigurationException.structural(
                "setting '" + owner + "' declares range " + range.describe() + " with a non-positive step"
            );
        }
        if (start.compareTo(end) > 0) {
            throw ConfigurationException.structural(
                "setting '" + owner + "' declares range " + range.describe() + " whose start exceeds its end"
            );
        }
        BigDecimal count = end.subtract(start).divideToIntegralValue(step).add(BigDecimal.ONE);
        if (count.compareTo(BigDecimal.valueOf(MAX_FAMILY_SIZE)) > 0) {
            throw tooLarge(owner);
        }
        var values = new ArrayList<String>();
        for (BigDecimal current = start; current.compareTo(end) <= 0; current = current.add(step)) {
            values.add(render(current));
        }
        return values;
    }

    private static ConfigurationException tooLarge(String owner) {
        return ConfigurationException.structural(
            "setting '" + owner + "' expands to more than " + MAX_FAMILY_SIZE + " settings"
        );
    }

    private static BigDecimal decimal(String raw, VariableDef.Range range, String owner) {
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException ex) {
            throw new ConfigurationException(
                Diagnostic.Category.STRUCTURAL,
                "setting '" + owner + "' declares malformed range '" + range.describe() + "'",
                ex
            );
        }
    }

    static String render(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    private static final class FamilyIterator implements Iterator<Setting> {
        private final Setting base;
        private final List<List<String>> axes;
        private final int[] cursor;
        private boolean exhausted;

        FamilyIterator(Setting base, List<List<String>> axes) {
            this.base = base;
            this.axes = axes;
            this.cursor = new int[axes.size()];
        }

        @Override
        public boolean hasNext() {
            return !exhausted;
        }

        @Override
        public Setting next() {
            if (exhausted) {
                throw new NoSuchElementException();
            }
            var current = materialize();
            advance();
            return current;
        }

        private Setting materialize() {
            var name = new StringBuilder(base.name());
            var pre = new StringBuilder(base.cmdline());
            var post = new StringBuilder(base.cmdlinePost());
            for (int i = 0; i < axes.size(); i++) {
                VariableDef variable = base.variables().get(i);
                String value = axes.get(i).get(cursor[i]);
                name.append('_').append(value);
                append(variable.post() ? post : pre, variable.fragment(value));
            }
            return base.derive(name.toString(), pre.toString(), post.toString());
        }

        private void advance() {
            for (int i = axes.size() - 1; i >= 0; i--) {
                cursor[i]++;
                if (cursor[i] < axes.get(i).size()) {
                    return;
                }
                cursor[i] = 0;
            }
            exhausted = true;
        }

        private static void append(StringBuilder target, String fragment) {
            if (target.length() > 0) {
                target.append(' ');
            }
            target.append(fragment);
        }
    }
}
