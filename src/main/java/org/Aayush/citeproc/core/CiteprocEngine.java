package org.Aayush.citeproc.core;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.citeproc.diagnostics.Diagnostic;
import org.Aayush.citeproc.diagnostics.DiagnosticCollector;
import org.Aayush.citeproc.disambiguation.DisambData;
import org.Aayush.citeproc.disambiguation.DisambiguationBudget;
import org.Aayush.citeproc.disambiguation.DisambiguationOutcome;
import org.Aayush.citeproc.disambiguation.Disambiguator;
import org.Aayush.citeproc.disambiguation.HintTable;
import org.Aayush.citeproc.eval.CiteInfo;
import org.Aayush.citeproc.eval.DisambiguationHints;
import org.Aayush.citeproc.eval.EvalContext;
import org.Aayush.citeproc.eval.EvalMode;
import org.Aayush.citeproc.eval.Evaluator;
import org.Aayush.citeproc.locale.CslLocale;
import org.Aayush.citeproc.locale.LocaleRegistry;
import org.Aayush.citeproc.locale.LocaleResolution;
import org.Aayush.citeproc.output.Formatted;
import org.Aayush.citeproc.output.Formatting;
import org.Aayush.citeproc.output.Output;
import org.Aayush.citeproc.output.Outputs;
import org.Aayush.citeproc.output.Tag;
import org.Aayush.citeproc.reference.Name;
import org.Aayush.citeproc.reference.Reference;
import org.Aayush.citeproc.render.CslRenderer;
import org.Aayush.citeproc.render.OutputRenderer;
import org.Aayush.citeproc.render.PlainTextRenderer;
import org.Aayush.citeproc.render.RendererRegistry;
import org.Aayush.citeproc.sort.ReferenceSorter;
import org.Aayush.citeproc.style.DisambiguationStrategy;
import org.Aayush.citeproc.style.Layout;
import org.Aayush.citeproc.style.NameOptions;
import org.Aayush.citeproc.style.Style;
import org.Aayush.citeproc.style.StyleClass;
import org.Aayush.citeproc.style.StyleException;
import org.Aayush.citeproc.style.StyleValidator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Citation processing entry point.
 *
 * <p>The engine binds a validated style, a locale and a default renderer once; each
 * {@link #process} call then runs independently with its own hint table and diagnostics, so one
 * engine may serve concurrent calls. Execution flow of a call:</p>
 * <ul>
 * <li>Index references by id and assign cite positions in document order.</li>
 * <li>Sort the bibliography and derive citation numbers.</li>
 * <li>Run the disambiguation state machine over plain-text renders of every cited reference.</li>
 * <li>Render citations with the final hints, collapsing cites per the layout's collapse mode,
 * then bibliography entries.</li>
 * </ul>
 */
@Slf4j
public final class CiteprocEngine {
    public static final String REASON_STYLE_INVALID = "CITEPROC_STYLE_INVALID";
    public static final String REASON_REFERENCES_REQUIRED = "CITEPROC_REFERENCES_REQUIRED";
    public static final String REASON_CITATIONS_REQUIRED = "CITEPROC_CITATIONS_REQUIRED";
    public static final String REASON_DUPLICATE_REFERENCE_ID = "CITEPROC_DUPLICATE_REFERENCE_ID";
    public static final String REASON_UNKNOWN_RENDERER = "CITEPROC_UNKNOWN_RENDERER";
    public static final String REASON_UNKNOWN_LOCALE = "CITEPROC_UNKNOWN_LOCALE";

    static final String DEFAULT_CITATION_DELIMITER = "; ";

    private final Style style;
    private final CslLocale locale;
    /** Locale fallback notice reported with every result, null when the locale matched exactly. */
    private final String localeFallback;
    private final CslRenderer<String> defaultRenderer;
    private final DisambiguationBudget budget;
    private final Evaluator evaluator = new Evaluator();
    private final ReferenceSorter sorter = new ReferenceSorter(evaluator);
    private final PlainTextRenderer plainText = new PlainTextRenderer();
    private final NameOptions citationNameOptions;
    private final NameOptions bibliographyNameOptions;
    private final boolean implicitYearSuffix;
    private final Formatting citationFormatting;
    private final CitationCollapser collapser;

    /**
     * Creates an engine bound to one style and locale.
     *
     * @param style style tree; validated here.
     * @param locale explicit locale; wins over {@code localeTag}.
     * @param localeTag locale tag resolved through {@code localeRegistry}; falls back to the
     *                  style's default locale, then the root locale.
     * @param localeRegistry optional locale registry override.
     * @param runtimeConfig optional runtime configuration (renderer id, pass budget).
     * @param rendererRegistry optional renderer registry override.
     * @throws CiteprocException when the style is malformed, the locale tag has no locale of its
     *                           language, or the renderer id is unknown.
     */
    @Builder
    public CiteprocEngine(
            Style style,
            CslLocale locale,
            String localeTag,
            LocaleRegistry localeRegistry,
            CiteprocRuntimeConfig runtimeConfig,
            RendererRegistry rendererRegistry
    ) {
        this.style = Objects.requireNonNull(style, "style");
        try {
            new StyleValidator().validate(style);
        } catch (StyleException ex) {
            throw new CiteprocException(REASON_STYLE_INVALID, ex.getMessage(), ex);
        }
        LocaleRegistry locales = localeRegistry == null ? LocaleRegistry.defaultRegistry() : localeRegistry;
        if (locale != null) {
            this.locale = locale;
            this.localeFallback = null;
        } else {
            LocaleResolution resolution = resolveLocale(locales, localeTag, style.getDefaultLocale());
            this.locale = resolution.getLocale();
            this.localeFallback = resolution.isFallbackApplied()
                    ? "locale '" + resolution.getRequestedTag() + "' resolved to '" + resolution.getLocale().lang() + "'"
                    : null;
        }

        CiteprocRuntimeConfig config = runtimeConfig == null ? CiteprocRuntimeConfig.defaultRuntime() : runtimeConfig;
        RendererRegistry renderers = rendererRegistry == null ? RendererRegistry.defaultRegistry() : rendererRegistry;
        String rendererId = config.getRendererId() == null ? PlainTextRenderer.ID : config.getRendererId();
        this.defaultRenderer = renderers.renderer(rendererId);
        if (defaultRenderer == null) {
            throw new CiteprocException(
                    REASON_UNKNOWN_RENDERER,
                    "unknown renderer id '" + rendererId + "', known ids " + renderers.ids()
            );
        }
        this.budget = config.getMaxDisambiguationPasses() > 0
                ? DisambiguationBudget.of(config.getMaxDisambiguationPasses())
                : DisambiguationBudget.defaults();

        NameOptions styleOptions = style.getNameOptions() == null ? NameOptions.EMPTY : style.getNameOptions();
        this.citationNameOptions = styleOptions.mergedWith(style.getCitation().getNameOptions());
        this.bibliographyNameOptions = style.getBibliography() == null
                ? styleOptions
                : styleOptions.mergedWith(style.getBibliography().getNameOptions());
        this.implicitYearSuffix = !style.rendersVariable("year-suffix");
        Layout citation = style.getCitation();
        this.citationFormatting = citation.getFormatting().hasDelimiter()
                ? citation.getFormatting()
                : citation.getFormatting().toBuilder().delimiter(DEFAULT_CITATION_DELIMITER).build();
        this.collapser = new CitationCollapser(citation, citationFormatting.getDelimiter(),
                new OutputRenderer<>(plainText, this.locale));
    }

    public CslLocale locale() {
        return locale;
    }

    /**
     * Processes citations with the configured renderer.
     *
     * @see #process(List, List, CslRenderer)
     */
    public ProcessResult<String> process(List<Reference> references, List<Citation> citations) {
        return process(references, citations, defaultRenderer);
    }

    /**
     * Renders citations and the bibliography.
     *
     * @param references every reference available to citations and the bibliography.
     * @param citations citations in document order.
     * @param renderer target format.
     * @param <R> renderer output type.
     * @return renderings plus diagnostics.
     * @throws CiteprocException on missing inputs, duplicate reference ids, or a style error
     *                           found during evaluation.
     */
    public <R> ProcessResult<R> process(List<Reference> references, List<Citation> citations, CslRenderer<R> renderer) {
        Objects.requireNonNull(renderer, "renderer");
        if (references == null) {
            throw new CiteprocException(REASON_REFERENCES_REQUIRED, "references are required");
        }
        if (citations == null) {
            throw new CiteprocException(REASON_CITATIONS_REQUIRED, "citations are required");
        }
        Map<String, Reference> byId = indexReferences(references);
        log.debug("processing {} citations over {} references with renderer '{}'",
                citations.size(), byId.size(), renderer.id());
        try {
            return new ProcessRun<>(byId, citations, renderer).execute();
        } catch (StyleException ex) {
            throw new CiteprocException(REASON_STYLE_INVALID, ex.getMessage(), ex);
        }
    }

    private static Map<String, Reference> indexReferences(List<Reference> references) {
        Map<String, Reference> byId = new LinkedHashMap<>();
        for (Reference reference : references) {
            Reference nonNullReference = Objects.requireNonNull(reference, "reference");
            if (byId.putIfAbsent(nonNullReference.getId(), nonNullReference) != null) {
                throw new CiteprocException(
                        REASON_DUPLICATE_REFERENCE_ID,
                        "duplicate reference id '" + nonNullReference.getId() + "'"
                );
            }
        }
        return byId;
    }

    private static LocaleResolution resolveLocale(LocaleRegistry registry, String localeTag, String styleDefault) {
        if (localeTag != null) {
            LocaleResolution resolution = registry.resolve(localeTag);
            if (resolution.isFallbackApplied() && !sameLanguage(localeTag, resolution.getLocale())) {
                throw new CiteprocException(
                        REASON_UNKNOWN_LOCALE,
                        "no locale for '" + localeTag + "', known tags " + registry.tags()
                );
            }
            return resolution;
        }
        LocaleResolution resolution = registry.resolve(styleDefault == null ? LocaleRegistry.ROOT_LOCALE : styleDefault);
        if (resolution.isFallbackApplied()) {
            log.debug("style default locale '{}' resolved to '{}'", styleDefault, resolution.getLocale().lang());
        }
        return resolution;
    }

    private static boolean sameLanguage(String tag, CslLocale locale) {
        int dash = tag.indexOf('-');
        String primary = dash < 0 ? tag : tag.substring(0, dash);
        return primary.equalsIgnoreCase(locale.primaryLanguage());
    }

    /**
     * State of one {@code process()} call.
     */
    private final class ProcessRun<R> {
        private final Map<String, Reference> references;
        private final List<Citation> citations;
        private final CslRenderer<R> renderer;
        private final DiagnosticCollector diagnostics = new DiagnosticCollector();
        private final Object2IntOpenHashMap<String> citationNumbers = new Object2IntOpenHashMap<>();
        private final Object2IntOpenHashMap<String> bibliographyIndex = new Object2IntOpenHashMap<>();

        private ProcessRun(Map<String, Reference> references, List<Citation> citations, CslRenderer<R> renderer) {
            this.references = references;
            this.citations = citations;
            this.renderer = renderer;
            bibliographyIndex.defaultReturnValue(Integer.MAX_VALUE);
        }

        private ProcessResult<R> execute() {
            if (localeFallback != null) {
                diagnostics.warn(Diagnostic.CODE_LOCALE_FALLBACK, null, localeFallback);
            }
            List<List<CiteInfo>> positions = new PositionTracker(style.getOptions().getNearNoteDistance())
                    .assign(citations);
            List<Reference> cited = citedReferences();
            List<Reference> bibliographyOrder = numberReferences(cited);

            HintTable hints = new HintTable();
            int passes = 0;
            DisambiguationStrategy strategy = style.getCitation().getDisambiguation();
            if (strategy.anyEnabled() && !cited.isEmpty()) {
                DisambiguationOutcome outcome = new Disambiguator(strategy, budget, diagnostics)
                        .run(table -> renderForDisambiguation(cited, table), bibliographyIndex::getInt);
                hints = outcome.getHints();
                passes = outcome.getPasses();
            }

            ProcessResult.ProcessResultBuilder<R> result = ProcessResult.<R>builder();
            OutputRenderer<R> output = new OutputRenderer<>(renderer, locale);
            for (int i = 0; i < citations.size(); i++) {
                Citation citation = citations.get(i);
                Output rendered = assembleCitation(citation, positions.get(i), hints);
                result.citation(new RenderedCitation<>(citation.getId(), output.render(rendered)));
            }
            Layout bibliography = style.getBibliography();
            if (bibliography != null) {
                for (Reference reference : bibliographyOrder) {
                    Output entry = assembleEntry(bibliography, reference, hints);
                    if (!entry.isNull()) {
                        result.entry(new BibliographyEntry<>(reference.getId(), output.render(entry)));
                    }
                }
            }
            List<Diagnostic> collected = diagnostics.snapshot();
            log.debug("processed {} citations, {} disambiguation passes, {} diagnostics",
                    citations.size(), passes, collected.size());
            return result.diagnostics(collected).disambiguationPasses(passes).build();
        }

        /**
         * Known cited references in first-citation order; unknown ids are reported.
         */
        private List<Reference> citedReferences() {
            Set<String> seen = new LinkedHashSet<>();
            List<Reference> cited = new ArrayList<>();
            for (Citation citation : citations) {
                for (CitationItem item : citation.getItems()) {
                    Reference reference = references.get(item.getId());
                    if (reference == null) {
                        diagnostics.warn(Diagnostic.CODE_UNKNOWN_REFERENCE, item.getId(),
                                "citation '" + citation.getId() + "' cites unknown reference '" + item.getId() + "'");
                    } else if (seen.add(item.getId())) {
                        cited.add(reference);
                    }
                }
            }
            return cited;
        }

        /**
         * Sorts the bibliography and fixes citation numbers: bibliography positions when the style
         * has a bibliography, first-citation order otherwise.
         */
        private List<Reference> numberReferences(List<Reference> cited) {
            List<Reference> initialOrder = new ArrayList<>(cited);
            Set<String> citedIds = new LinkedHashSet<>();
            for (Reference reference : cited) {
                citedIds.add(reference.getId());
            }
            for (Reference reference : references.values()) {
                if (!citedIds.contains(reference.getId())) {
                    initialOrder.add(reference);
                }
            }
            for (int i = 0; i < initialOrder.size(); i++) {
                citationNumbers.put(initialOrder.get(i).getId(), i + 1);
            }
            Layout bibliography = style.getBibliography();
            if (bibliography == null) {
                for (int i = 0; i < initialOrder.size(); i++) {
                    bibliographyIndex.put(initialOrder.get(i).getId(), i);
                }
                return initialOrder;
            }
            List<Reference> sorted = sorter.sort(initialOrder, bibliography.getSortKeys(), reference -> context(
                    reference,
                    EvalMode.BIBLIOGRAPHY,
                    bibliographyNameOptions,
                    CiteInfo.builder().citationNumber(citationNumbers.getInt(reference.getId())).build(),
                    DisambiguationHints.NONE
            ));
            for (int i = 0; i < sorted.size(); i++) {
                bibliographyIndex.put(sorted.get(i).getId(), i);
                citationNumbers.put(sorted.get(i).getId(), i + 1);
            }
            return sorted;
        }

        private List<DisambData> renderForDisambiguation(List<Reference> cited, HintTable table) {
            OutputRenderer<String> text = new OutputRenderer<>(plainText, locale);
            List<DisambData> data = new ArrayList<>(cited.size());
            for (Reference reference : cited) {
                String id = reference.getId();
                EvalContext ctx = context(
                        reference,
                        EvalMode.CITATION,
                        citationNameOptions,
                        CiteInfo.builder().citationNumber(citationNumbers.getInt(id)).build(),
                        table.hintsFor(id)
                );
                Output output = evaluator.evaluateLayout(style.getCitation(), ctx);
                String rendered = text.render(output);
                if (rendered.isEmpty()) {
                    continue;
                }
                List<Tag> nameLists = Outputs.findTags(output, Tag.Kind.NAMES);
                List<Name> names = nameLists.isEmpty() ? List.of() : nameLists.get(0).getNames();
                data.add(new DisambData(id, names, rendered));
            }
            return data;
        }

        private Output assembleCitation(Citation citation, List<CiteInfo> infos, HintTable hints) {
            List<Cite> cites = new ArrayList<>(citation.getItems().size());
            for (int i = 0; i < citation.getItems().size(); i++) {
                CitationItem item = citation.getItems().get(i);
                Reference reference = references.get(item.getId());
                if (reference != null) {
                    CiteInfo info = infos.get(i).toBuilder()
                            .citationNumber(citationNumbers.getInt(item.getId()))
                            .build();
                    cites.add(new Cite(item, reference, info));
                }
            }
            Layout layout = style.getCitation();
            List<Cite> ordered = sorter.sort(cites, layout.getSortKeys(), cite -> context(
                    cite.reference(), EvalMode.CITATION, citationNameOptions, cite.info(), DisambiguationHints.NONE));

            List<CitationCollapser.Item> items = new ArrayList<>(ordered.size());
            for (Cite cite : ordered) {
                CitationItem item = cite.item();
                items.add(new CitationCollapser.Item(
                        assembleItem(layout, cite, hints.hintsFor(cite.reference().getId())),
                        item.getPrefix() != null && !item.getPrefix().isEmpty(),
                        item.getSuffix() != null && !item.getSuffix().isEmpty()));
            }
            Output assembled = Output.formatted(citationFormatting, List.of(collapser.collapse(items)));
            return style.getStyleClass() == StyleClass.NOTE ? Output.inNote(assembled) : assembled;
        }

        private Output assembleItem(Layout layout, Cite cite, DisambiguationHints hints) {
            EvalContext ctx = context(cite.reference(), EvalMode.CITATION, citationNameOptions, cite.info(), hints);
            Output body = evaluator.evaluateLayout(layout, ctx);
            CitationItem item = cite.item();
            Tag.ItemKind kind = Tag.ItemKind.NORMAL;
            if (item.isAuthorOnly()) {
                body = Outputs.firstNames(body);
                kind = Tag.ItemKind.AUTHOR_ONLY;
            } else if (item.isSuppressAuthor()) {
                body = Outputs.suppressNames(body);
                kind = Tag.ItemKind.SUPPRESS_AUTHOR;
            }
            Formatting affixes = Formatting.builder()
                    .prefix(item.getPrefix())
                    .suffix(item.getSuffix())
                    .language(cite.reference().getLanguage())
                    .build();
            return Output.tagged(Tag.item(item.getId(), kind), Output.formatted(affixes, List.of(body)));
        }

        private Output assembleEntry(Layout layout, Reference reference, HintTable hints) {
            EvalContext ctx = context(
                    reference,
                    EvalMode.BIBLIOGRAPHY,
                    bibliographyNameOptions,
                    CiteInfo.builder().citationNumber(citationNumbers.getInt(reference.getId())).build(),
                    hints.hintsFor(reference.getId()).forBibliography()
            );
            Output body = evaluator.evaluateLayout(layout, ctx);
            Formatting formatting = reference.getLanguage() == null
                    ? layout.getFormatting()
                    : layout.getFormatting().toBuilder().language(reference.getLanguage()).build();
            if (layout.getSecondFieldAlign() != null) {
                body = alignSecondField(body, formatting.getSuffix());
                formatting = formatting.toBuilder().suffix(null).build();
            }
            return Output.tagged(
                    Tag.item(reference.getId(), Tag.ItemKind.NORMAL),
                    Output.formatted(formatting, List.of(body))
            );
        }

        /**
         * Splits an entry into a left-margin block holding its first field and a right-inline block
         * holding the rest; the layout suffix moves into the right-inline block.
         */
        private Output alignSecondField(Output body, String layoutSuffix) {
            if (body.kind() != Output.Kind.FORMATTED) {
                return body;
            }
            List<Output> fields = ((Formatted) body).children();
            Output margin = Output.formatted(
                    Formatting.builder().display(Formatting.Display.LEFT_MARGIN).build(),
                    List.of(fields.get(0)));
            if (fields.size() == 1) {
                return margin;
            }
            Output inline = Output.formatted(
                    Formatting.builder()
                            .display(Formatting.Display.RIGHT_INLINE)
                            .suffix(layoutSuffix)
                            .affixesInside(true)
                            .build(),
                    fields.subList(1, fields.size()));
            return Output.sequence(List.of(margin, inline));
        }

        private EvalContext context(
                Reference reference,
                EvalMode mode,
                NameOptions nameOptions,
                CiteInfo cite,
                DisambiguationHints hints
        ) {
            return EvalContext.builder()
                    .style(style)
                    .locale(locale)
                    .reference(reference)
                    .mode(mode)
                    .cite(cite)
                    .hints(hints)
                    .inheritedNameOptions(nameOptions)
                    .diagnostics(diagnostics)
                    .implicitYearSuffix(implicitYearSuffix)
                    .build();
        }
    }

    private record Cite(CitationItem item, Reference reference, CiteInfo info) {
    }
}
