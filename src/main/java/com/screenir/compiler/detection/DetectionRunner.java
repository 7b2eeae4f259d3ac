package com.screenir.compiler.detection;

import com.screenir.compiler.ir.IrNode;
import com.screenir.compiler.styles.StylesBundle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs list and repetition detection over an IR tree, then state detection over the
 * items of every list and the instances of every repeated component.
 */
public class DetectionRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunner.class);

    private final ListDetector listDetector;
    private final RepetitionDetector repetitionDetector;
    private final StateDetector stateDetector;

    public DetectionRunner() {
        this(new ListDetector(), new RepetitionDetector(), new StateDetector());
    }

    public DetectionRunner(ListDetector listDetector, RepetitionDetector repetitionDetector,
                           StateDetector stateDetector) {
        this.listDetector = listDetector;
        this.repetitionDetector = repetitionDetector;
        this.stateDetector = stateDetector;
    }

    public DetectionResult run(IrNode root, StylesBundle bundle) {
        Map<String, IrNode> byId = new HashMap<>();
        root.walk(node -> byId.putIfAbsent(node.getId(), node));

        DetectionResult.DetectionResultBuilder result = DetectionResult.builder();

        List<ListHint> lists = listDetector.detectLists(root);
        for (ListHint list : lists) {
            result.list(list);
            detectState(DetectedState.Source.LIST, list.getContainerId(), resolve(list.getItemIds(), byId), bundle)
                    .ifPresent(result::state);
        }

        List<ComponentHint> components = repetitionDetector.detectRepetitions(root);
        for (ComponentHint component : components) {
            result.component(component);
            detectState(DetectedState.Source.COMPONENT, component.getComponentName(),
                    resolve(component.getInstanceIds(), byId), bundle)
                    .ifPresent(result::state);
        }

        DetectionResult detection = result.build();
        log.debug("Detection finished: {} list(s), {} component(s), {} state(s)",
                detection.getLists().size(), detection.getComponents().size(), detection.getStates().size());
        return detection;
    }

    private Optional<DetectedState> detectState(DetectedState.Source source, String ownerId,
                                                List<IrNode> instances, StylesBundle bundle) {
        StateDetectionResult detected = stateDetector.detect(instances, bundle);
        return detected.findState()
                .map(state -> new DetectedState(source, ownerId, state, detected.getConfidence()));
    }

    private static List<IrNode> resolve(List<String> ids, Map<String, IrNode> byId) {
        List<IrNode> nodes = new ArrayList<>(ids.size());
        for (String id : ids) {
            IrNode node = byId.get(id);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }
}
