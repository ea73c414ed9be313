package org.Aayush.citeproc.eval;

import org.Aayush.citeproc.reference.CitationLabel;
import org.Aayush.citeproc.reference.CslDate;
import org.Aayush.citeproc.style.ChooseBranch;
import org.Aayush.citeproc.style.Condition;
import org.Aayush.citeproc.style.Position;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Tests {@code <if>} branches. Each value of each condition is one test; the branch's match
 * mode combines all tests.
 */
final class ConditionEvaluator {
    static final String LOCATOR = "locator";

    boolean matches(ChooseBranch branch, EvalContext ctx) {
        if (branch.isElse()) {
            return true;
        }
        List<Boolean> results = new ArrayList<>();
        for (Condition condition : branch.getConditions()) {
            for (String value : condition.getValues()) {
                results.add(test(condition.getType(), value, ctx));
            }
        }
        return switch (branch.getMatch()) {
            case ALL -> !results.contains(Boolean.FALSE);
            case ANY -> results.contains(Boolean.TRUE);
            case NONE -> !results.contains(Boolean.TRUE);
        };
    }

    private boolean test(Condition.Type type, String value, EvalContext ctx) {
        return switch (type) {
            case TYPE -> value.equals(ctx.reference().getType());
            case VARIABLE -> hasVariable(value, ctx);
            case IS_NUMERIC -> NumberFormatter.isNumeric(textValue(value, ctx));
            case IS_UNCERTAIN_DATE -> {
                CslDate date = ctx.reference().date(value);
                yield date != null && date.isCirca();
            }
            case LOCATOR -> ctx.cite().getLocator() != null && value.equals(ctx.cite().effectiveLabel());
            case POSITION -> positionMatches(value, ctx);
            case DISAMBIGUATE -> Boolean.parseBoolean(value) == ctx.hints().isDisambiguate();
            case LOCALE -> languageMatches(value, ctx);
        };
    }

    private boolean hasVariable(String variable, EvalContext ctx) {
        if (ctx.state().isQuashed(variable)) {
            return false;
        }
        if (LOCATOR.equals(variable)) {
            return ctx.cite().getLocator() != null && !ctx.cite().getLocator().isBlank();
        }
        if ("citation-number".equals(variable)) {
            return ctx.cite().getCitationNumber() > 0;
        }
        if ("year-suffix".equals(variable)) {
            return ctx.hints().getYearSuffix() > 0;
        }
        if (CitationLabel.VARIABLE.equals(variable)) {
            return true;
        }
        return ctx.reference().hasVariable(variable);
    }

    private String textValue(String variable, EvalContext ctx) {
        if (LOCATOR.equals(variable)) {
            return ctx.cite().getLocator();
        }
        return ctx.reference().variable(variable);
    }

    /**
     * Positions never hold outside citations.
     */
    private boolean positionMatches(String value, EvalContext ctx) {
        if (!ctx.isCitation()) {
            return false;
        }
        Position tested = Position.valueOf(value);
        if (tested == Position.NEAR_NOTE) {
            return ctx.cite().isNearNote();
        }
        return tested.matchedBy(ctx.cite().getPosition());
    }

    private boolean languageMatches(String value, EvalContext ctx) {
        String language = ctx.reference().getLanguage() != null
                ? ctx.reference().getLanguage()
                : ctx.locale().lang();
        return primary(language).equals(primary(value));
    }

    private static String primary(String tag) {
        String normalized = tag.replace('_', '-').toLowerCase(Locale.ROOT);
        int dash = normalized.indexOf('-');
        return dash < 0 ? normalized : normalized.substring(0, dash);
    }
}
