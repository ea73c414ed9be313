package org.Aayush.citeproc.eval;

import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Tag;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.style.Element;
import org.Aayush.citeproc.style.LabelElement;
import org.Aayush.citeproc.style.NameOptions;
import org.Aayush.citeproc.style.NamesElement;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates {@code <names>}: non-empty variables, editor/translator collapse, labels and the
 * substitute fallback.
 */
final class NamesEvaluator {
    static final String EDITOR = "editor";
    static final String TRANSLATOR = "translator";
    static final String EDITOR_TRANSLATOR = "editortranslator";

    private final Evaluator evaluator;
    private final NameFormatter formatter;

    NamesEvaluator(Evaluator evaluator) {
        this.evaluator = evaluator;
        this.formatter = new NameFormatter(evaluator);
    }

    Output evaluate(NamesElement element, EvalContext ctx) {
        NameOptions options = effectiveOptions(element, ctx);
        List<String> variables = new ArrayList<>();
        List<List<Name>> lists = new ArrayList<>();
        for (String variable : element.getVariables()) {
            List<Name> names = ctx.state().isQuashed(variable) ? List.of() : ctx.reference().names(variable);
            ctx.tracker().record(variable, !names.isEmpty());
            if (!names.isEmpty()) {
                variables.add(variable);
                lists.add(names);
            }
        }
        if (variables.isEmpty()) {
            return substitute(element, options, ctx);
        }
        collapseEditorTranslator(variables, lists);

        if (options.getForm() == NameOptions.Form.COUNT) {
            int count = 0;
            for (List<Name> names : lists) {
                count += formatter.shownCount(names.size(), options, ctx);
            }
            return Output.formatted(element.getFormatting().toBuilder().delimiter(null).build(),
                    List.of(Output.literal(Integer.toString(count))));
        }

        List<Output> rendered = new ArrayList<>(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            String variable = variables.get(i);
            List<Name> names = lists.get(i);
            Output list = formatter.format(variable, names, options, ctx, element.describe());
            rendered.add(withLabel(element, variable, names.size(), list, ctx));
        }
        return Output.formatted(element.getFormatting(), rendered);
    }

    /**
     * Name options in force for an element: a names element without its own options inside a
     * substitute takes the substituting element's options.
     */
    NameOptions effectiveOptions(NamesElement element, EvalContext ctx) {
        if (element.getName() == null && ctx.inSubstitute() && ctx.substituteNameOptions() != null) {
            return ctx.substituteNameOptions();
        }
        return ctx.inheritedNameOptions().mergedWith(element.getName());
    }

    private Output substitute(NamesElement element, NameOptions options, EvalContext ctx) {
        EvalContext substituteCtx = ctx.withSubstitute(options);
        for (Element child : element.getSubstitute()) {
            VariableTracker scope = new VariableTracker();
            Output output = evaluator.evaluate(child, substituteCtx.withTracker(scope));
            scope.mergeInto(ctx.tracker());
            if (!output.isNull()) {
                for (String variable : scope.nonEmptyVariables()) {
                    ctx.state().quash(variable);
                }
                String first = element.getVariables().isEmpty() ? null : element.getVariables().get(0);
                return Output.tagged(Tag.names(first, List.of()),
                        Output.formatted(element.getFormatting().toBuilder().delimiter(null).build(), List.of(output)));
            }
        }
        if (!ctx.inSubstitute() && !element.getVariables().isEmpty()) {
            ctx.diagnostics().warn(Diagnostic.CODE_MISSING_VARIABLE, ctx.referenceId(),
                    "no names for " + String.join(", ", element.getVariables()));
        }
        return Output.nullOutput();
    }

    private Output withLabel(NamesElement element, String variable, int count, Output list, EvalContext ctx) {
        LabelElement label = element.getLabel();
        if (label == null) {
            return list;
        }
        boolean plural = switch (label.getPlural()) {
            case ALWAYS -> true;
            case NEVER -> false;
            case CONTEXTUAL -> count > 1;
        };
        String term = evaluator.optionalTerm(variable, label.getForm(), plural, ctx);
        Output labelOutput = Output.tagged(Tag.term(variable),
                Output.formatted(label.getFormatting(), List.of(Output.literal(term))));
        return element.isLabelBeforeName()
                ? Output.sequence(List.of(labelOutput, list))
                : Output.sequence(List.of(list, labelOutput));
    }

    private static void collapseEditorTranslator(List<String> variables, List<List<Name>> lists) {
        int editor = variables.indexOf(EDITOR);
        int translator = variables.indexOf(TRANSLATOR);
        if (editor < 0 || translator < 0 || !lists.get(editor).equals(lists.get(translator))) {
            return;
        }
        variables.set(editor, EDITOR_TRANSLATOR);
        variables.remove(translator);
        lists.remove(translator);
    }
}
