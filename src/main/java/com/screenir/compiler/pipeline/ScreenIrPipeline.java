package com.screenir.compiler.pipeline;

import com.screenir.compiler.detection.DetectionResult;
import com.screenir.compiler.detection.DetectionRunner;
import com.screenir.compiler.ir.ContainerIr;
import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.layout.LayoutClassifier;
import com.screenir.compiler.layout.LayoutMeta;
import com.screenir.compiler.layout.LayoutNode;
import com.screenir.compiler.mapping.TokenMappings;
import com.screenir.compiler.mapping.TokenMatcher;
import com.screenir.compiler.model.raw.BoundingBox;
import com.screenir.compiler.model.raw.RawNode;
import com.screenir.compiler.normalize.NormalizedNode;
import com.screenir.compiler.normalize.SafeAreaDetection;
import com.screenir.compiler.normalize.SafeAreaDetector;
import com.screenir.compiler.normalize.TreeNormalizer;
import com.screenir.compiler.recognize.SemanticClassifier;
import com.screenir.compiler.styles.StyleExtractor;
import com.screenir.compiler.styles.StylesBundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Compiles a raw design tree into a {@link ScreenIr}:
 * normalize, add layout, recognize roles, extract styles. {@link #analyze(ScreenIr)}
 * then runs pattern detection and token mapping over the result.
 *
 * <p>Stateless between runs; one instance may serve concurrent callers.
 */
public class ScreenIrPipeline {

    private static final Logger log = LoggerFactory.getLogger(ScreenIrPipeline.class);

    static final String EMPTY_STYLE_REF = "style_empty";

    private final PipelineOptions options;
    private final SafeAreaDetector safeAreaDetector;
    private final TreeNormalizer normalizer;
    private final LayoutClassifier layoutClassifier;
    private final SemanticClassifier semanticClassifier;
    private final StyleExtractor styleExtractor;
    private final DetectionRunner detectionRunner;
    private final TokenMatcher tokenMatcher;

    public ScreenIrPipeline() {
        this(PipelineOptions.defaults());
    }

    public ScreenIrPipeline(PipelineOptions options) {
        this.options = options;
        this.safeAreaDetector = new SafeAreaDetector();
        this.normalizer = new TreeNormalizer();
        this.layoutClassifier = new LayoutClassifier();
        this.semanticClassifier = new SemanticClassifier(options.getClassifierOptions());
        this.styleExtractor = new StyleExtractor();
        this.detectionRunner = new DetectionRunner();
        this.tokenMatcher = new TokenMatcher();
    }

    public PipelineOptions getOptions() {
        return options;
    }

    /**
     * Runs {@link #transform(RawNode)} and {@link #analyze(ScreenIr)}.
     */
    public ScreenAnalysis compile(RawNode root) {
        return analyze(transform(root));
    }

    /**
     * Never returns {@code null}: a root removed by normalization yields an empty
     * screen.
     */
    public ScreenIr transform(RawNode root) {
        SafeAreaDetection safeArea = safeAreaDetector.detect(root, options.getConventions());
        Optional<NormalizedNode> normalized =
                normalizer.normalize(root, options.getConventions(), safeArea.getExcludeIds());
        if (normalized.isEmpty()) {
            log.info("Screen '{}' is empty after normalization", root.getName());
            return emptyScreen(root);
        }

        LayoutNode layoutRoot = layoutClassifier.addLayout(normalized.get());
        IrNode irRoot = semanticClassifier.recognize(layoutRoot);
        StylesBundle stylesBundle = styleExtractor.extract(irRoot, layoutRoot);

        log.debug("Compiled screen '{}': {} IR node(s), {} style(s)",
                root.getName(), irRoot.countNodes(), stylesBundle.getStyles().size());
        return ScreenIr.builder()
                .id(root.getId())
                .name(root.getName())
                .root(irRoot)
                .stylesBundle(stylesBundle)
                .safeAreaInsets(safeArea.getInsets())
                .hasSafeAreaLayout(safeArea.isHasSafeAreaLayout())
                .build();
    }

    public ScreenAnalysis analyze(ScreenIr screen) {
        DetectionResult detection = detectionRunner.run(screen.getRoot(), screen.getStylesBundle());
        TokenMappings mappings = tokenMatcher.matchTokens(screen.getStylesBundle().getTokens(),
                options.getProjectTokens(), options.getColorThreshold());
        return new ScreenAnalysis(screen, detection, mappings);
    }

    static ScreenIr emptyScreen(RawNode root) {
        ContainerIr container = ContainerIr.builder()
                .id(root.getId())
                .name(root.getName())
                .boundingBox(BoundingBox.ZERO)
                .styleRef(EMPTY_STYLE_REF)
                .layout(LayoutMeta.emptyColumn())
                .build();
        return ScreenIr.builder()
                .id(root.getId())
                .name(root.getName())
                .root(container)
                .stylesBundle(StylesBundle.empty())
                .build();
    }
}
