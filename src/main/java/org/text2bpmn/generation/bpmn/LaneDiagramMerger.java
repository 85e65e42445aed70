package org.text2bpmn.generation.bpmn;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.text2bpmn.generation.bpmn.models.BoundsRect;
import org.text2bpmn.generation.bpmn.models.LaneFailurePolicy;
import org.text2bpmn.generation.bpmn.models.LaneFragment;
import org.text2bpmn.generation.exceptions.MergeException;
import org.text2bpmn.generation.processModel.models.SequenceFlow;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.childElements;
import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.elements;
import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.firstElement;
import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.formatCoordinate;
import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.parseCoordinate;
import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.readBounds;
import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.shapesByElementId;
import static org.text2bpmn.generation.bpmn.BpmnDocumentHelper.writeBounds;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.BPMNDI_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.BPMN_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.DC_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.DI_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.XSI_NS;
import static org.text2bpmn.generation.bpmn.BpmnNamespaces.qualified;

/**
 * Assembles independently laid-out lane documents into one pool diagram.
 * <p>
 * Lanes are stacked top to bottom in the order given. Each lane keeps its internal layout;
 * only a rigid translation is applied to its shapes and edges. Flows between lanes are
 * drawn afterwards as straight two-point edges, and the pool is added last.
 */
public class LaneDiagramMerger {
    private static final Logger LOG = LoggerFactory.getLogger(LaneDiagramMerger.class);

    public static final double LANE_MARGIN = 60;
    public static final double POOL_HEADER_WIDTH = 30;
    public static final String COLLABORATION_ID = "Collaboration_1";
    public static final String PARTICIPANT_ID = "Participant_1";
    public static final String PARTICIPANT_SHAPE_ID = PARTICIPANT_ID + "_di";
    public static final String DEFAULT_TARGET_NAMESPACE = "http://bpmn.io/schema/bpmn";

    // process children that belong to the base document only
    private static final Set<String> NON_FLOW_PROCESS_CHILDREN = Set.of("laneSet", "documentation", "extensionElements");

    private final LaneFailurePolicy laneFailurePolicy;

    public LaneDiagramMerger(LaneFailurePolicy laneFailurePolicy) {
        this.laneFailurePolicy = Objects.requireNonNull(laneFailurePolicy, "laneFailurePolicy");
    }

    /**
     * Sizes every lane of a fragment to enclose its flow nodes with a margin of
     * {@value #LANE_MARGIN} on each side. Updates an existing lane shape or inserts a new
     * horizontal one as the first child of the plane. Running it twice yields the same bounds.
     *
     * @param laneXml a laid-out lane document
     * @return the document with lane shapes
     */
    public static String addLaneShape(String laneXml) {
        Document doc = BpmnDocumentHelper.parse(laneXml);
        Element plane = requirePlane(doc, "Lane fragment");
        Map<String, Element> shapes = shapesByElementId(plane);

        for (Element lane : elements(doc, BPMN_NS, "lane")) {
            String laneId = lane.getAttribute("id");

            BoundsRect content = null;
            for (Element ref : elements(lane, BPMN_NS, "flowNodeRef")) {
                Element shape = shapes.get(ref.getTextContent().trim());
                BoundsRect bounds = shape == null ? null : readBounds(shape);
                if (bounds != null) {
                    content = content == null ? bounds : content.union(bounds);
                }
            }
            if (content == null) {
                LOG.warn("Lane '{}' has no laid-out flow nodes, no lane shape added", laneId);
                continue;
            }

            Element laneShape = shapes.get(laneId);
            if (laneShape == null) {
                laneShape = createShape(doc, laneId + "_di", laneId);
                laneShape.appendChild(doc.createElementNS(BPMNDI_NS, qualified(BPMNDI_NS, "BPMNLabel")));
                plane.insertBefore(laneShape, plane.getFirstChild());
                shapes.put(laneId, laneShape);
            }
            writeBounds(laneShape, content.pad(LANE_MARGIN));
        }

        return BpmnDocumentHelper.toXml(doc);
    }

    /**
     * Stacks lane fragments into the first resolvable one.
     * <p>
     * Every fragment must carry a process and a diagram plane. Elements the normalizer
     * inserted are removed from every fragment, including the base. A fragment whose lane
     * or lane bounds cannot be found is handled according to the {@link LaneFailurePolicy}.
     *
     * @param fragments lane fragments in stacking order
     * @return the merged document, without cross-lane flows or pool
     * @throws MergeException if a fragment is structurally unusable or no lane can be placed
     */
    public String mergeLanes(List<LaneFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new MergeException("No lane fragments to merge");
        }

        // parse everything first so a broken fragment fails before any output exists
        List<ParsedFragment> parsed = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            parsed.add(parseFragment(i, fragments.get(i)));
        }

        MergedDiagram merged = null;
        for (ParsedFragment fragment : parsed) {
            ResolvedLane lane = resolveLane(fragment);
            if (lane == null) {
                continue;
            }
            if (merged == null) {
                merged = new MergedDiagram(fragment, lane);
            } else {
                merged.append(fragment, lane);
            }
        }

        if (merged == null) {
            throw new MergeException("None of the " + fragments.size() + " lane fragments has a lane that can be placed");
        }
        merged.equalizeLaneWidths();
        LOG.info("Merged {} of {} lane fragments", merged.laneCount, fragments.size());
        return BpmnDocumentHelper.toXml(merged.doc);
    }

    /**
     * Adds flows whose endpoints sit in different lanes. A flow is skipped when its id is
     * already present or either endpoint has no shape.
     *
     * @param mergedXml      the merged document
     * @param crossLaneFlows flows to add, in order
     * @return the document with the new flows and their edges
     */
    public static String addCrossLaneFlows(String mergedXml, List<SequenceFlow> crossLaneFlows) {
        Document doc = BpmnDocumentHelper.parse(mergedXml);
        Element process = requireProcess(doc, "Merged document");
        Element plane = requirePlane(doc, "Merged document");

        Set<String> existingFlowIds = new HashSet<>();
        for (Element flow : elements(process, BPMN_NS, "sequenceFlow")) {
            existingFlowIds.add(flow.getAttribute("id"));
        }
        Map<String, Element> shapes = shapesByElementId(plane);

        int added = 0;
        for (SequenceFlow flow : crossLaneFlows) {
            if (isBlank(flow.id()) || isBlank(flow.sourceRef()) || isBlank(flow.targetRef())) {
                LOG.warn("Skipping cross-lane flow with missing id or endpoint: {}", flow);
                continue;
            }
            if (existingFlowIds.contains(flow.id())) {
                LOG.debug("Cross-lane flow '{}' already present", flow.id());
                continue;
            }
            BoundsRect source = boundsOf(shapes, flow.sourceRef());
            BoundsRect target = boundsOf(shapes, flow.targetRef());
            if (source == null || target == null) {
                LOG.warn("Skipping cross-lane flow '{}': no shape for '{}'",
                        flow.id(), source == null ? flow.sourceRef() : flow.targetRef());
                continue;
            }

            process.appendChild(createSequenceFlow(doc, flow));
            plane.appendChild(createEdge(doc, flow.id(), source, target));
            existingFlowIds.add(flow.id());
            added++;
        }

        LOG.info("Added {} of {} cross-lane flows", added, crossLaneFlows.size());
        return BpmnDocumentHelper.toXml(doc);
    }

    /**
     * Wraps the process in a collaboration with a single participant and draws the pool
     * around the stacked lanes. A previous collaboration is replaced.
     *
     * @param mergedXml the merged document
     * @param poolName  participant name, may be {@code null}
     * @return the final document
     */
    public static String addPool(String mergedXml, String poolName) {
        Document doc = BpmnDocumentHelper.parse(mergedXml);
        Element definitions = doc.getDocumentElement();
        Element process = requireProcess(doc, "Merged document");
        Element plane = requirePlane(doc, "Merged document");

        if (definitions.getAttribute("targetNamespace").isEmpty()) {
            definitions.setAttribute("targetNamespace", DEFAULT_TARGET_NAMESPACE);
        }

        for (Element collaboration : elements(doc, BPMN_NS, "collaboration")) {
            removePoolShapes(plane, collaboration);
            collaboration.getParentNode().removeChild(collaboration);
        }

        Element collaboration = doc.createElementNS(BPMN_NS, qualified(BPMN_NS, "collaboration"));
        collaboration.setAttribute("id", COLLABORATION_ID);
        Element participant = doc.createElementNS(BPMN_NS, qualified(BPMN_NS, "participant"));
        participant.setAttribute("id", PARTICIPANT_ID);
        if (poolName != null) {
            participant.setAttribute("name", poolName);
        }
        participant.setAttribute("processRef", process.getAttribute("id"));
        collaboration.appendChild(participant);
        process.getParentNode().insertBefore(collaboration, process);

        plane.setAttribute("bpmnElement", COLLABORATION_ID);

        Map<String, Element> shapes = shapesByElementId(plane);
        List<BoundsRect> laneBounds = new ArrayList<>();
        for (Element lane : elements(process, BPMN_NS, "lane")) {
            BoundsRect bounds = boundsOf(shapes, lane.getAttribute("id"));
            if (bounds != null) {
                laneBounds.add(bounds);
            }
        }

        if (laneBounds.isEmpty()) {
            LOG.warn("No lane shapes found, pool '{}' is drawn without a participant shape", poolName);
        } else {
            double minX = laneBounds.stream().mapToDouble(BoundsRect::x).min().getAsDouble();
            double minY = laneBounds.stream().mapToDouble(BoundsRect::y).min().getAsDouble();
            double height = laneBounds.stream().mapToDouble(BoundsRect::height).sum();
            double width = laneBounds.get(0).width() + POOL_HEADER_WIDTH;

            Element poolShape = createShape(doc, PARTICIPANT_SHAPE_ID, PARTICIPANT_ID);
            poolShape.appendChild(doc.createElementNS(BPMNDI_NS, qualified(BPMNDI_NS, "BPMNLabel")));
            writeBounds(poolShape, new BoundsRect(
                    Math.round(minX - POOL_HEADER_WIDTH), Math.round(minY), Math.round(width), Math.round(height)));
            plane.insertBefore(poolShape, plane.getFirstChild());
        }

        return BpmnDocumentHelper.toXml(doc);
    }

    private ParsedFragment parseFragment(int index, LaneFragment fragment) {
        String label = String.format("Lane fragment %d (%s)", index + 1, fragment.lane().id());
        Document doc = BpmnDocumentHelper.parse(fragment.xml());
        Element process = requireProcess(doc, label);
        Element plane = requirePlane(doc, label);
        stripMocks(process, plane, fragment.mockIds());
        return new ParsedFragment(label, fragment.lane().id(), doc, process, plane);
    }

    private ResolvedLane resolveLane(ParsedFragment fragment) {
        Element laneSet = firstElement(fragment.process(), BPMN_NS, "laneSet");
        if (laneSet == null) {
            return unresolvable(fragment, "has no laneSet");
        }

        List<Element> lanes = elements(laneSet, BPMN_NS, "lane");
        Element lane = lanes.stream()
                .filter(candidate -> fragment.laneId().equals(candidate.getAttribute("id")))
                .findFirst()
                .orElse(lanes.isEmpty() ? null : lanes.get(0));
        if (lane == null) {
            return unresolvable(fragment, "has no lane");
        }

        Element shape = shapesByElementId(fragment.plane()).get(lane.getAttribute("id"));
        BoundsRect bounds = shape == null ? null : readBounds(shape);
        if (bounds == null) {
            return unresolvable(fragment, "has no bounds for lane '" + lane.getAttribute("id") + "'");
        }
        return new ResolvedLane(laneSet, lane, shape, bounds);
    }

    private ResolvedLane unresolvable(ParsedFragment fragment, String reason) {
        String message = fragment.label() + " " + reason;
        if (laneFailurePolicy == LaneFailurePolicy.ABORT) {
            throw new MergeException(message);
        }
        LOG.warn("Dropping lane: {}", message);
        return null;
    }

    private static void stripMocks(Element process, Element plane, Set<String> mockIds) {
        if (mockIds.isEmpty()) {
            return;
        }
        for (Element child : childElements(process)) {
            if (mockIds.contains(child.getAttribute("id"))) {
                process.removeChild(child);
            }
        }
        for (String refName : List.of("flowNodeRef", "incoming", "outgoing")) {
            for (Element ref : elements(process, BPMN_NS, refName)) {
                if (mockIds.contains(ref.getTextContent().trim())) {
                    ref.getParentNode().removeChild(ref);
                }
            }
        }
        for (Element child : childElements(plane)) {
            if (mockIds.contains(child.getAttribute("bpmnElement"))) {
                plane.removeChild(child);
            }
        }
    }

    private static void translate(Element plane, double dx, double dy) {
        for (Element bounds : elements(plane, DC_NS, "Bounds")) {
            shift(bounds, dx, dy);
        }
        for (Element waypoint : elements(plane, DI_NS, "waypoint")) {
            shift(waypoint, dx, dy);
        }
    }

    private static void shift(Element point, double dx, double dy) {
        point.setAttribute("x", formatCoordinate(parseCoordinate(point.getAttribute("x")) + dx));
        point.setAttribute("y", formatCoordinate(parseCoordinate(point.getAttribute("y")) + dy));
    }

    private static void removePoolShapes(Element plane, Element collaboration) {
        Set<String> participantIds = new HashSet<>();
        for (Element participant : elements(collaboration, BPMN_NS, "participant")) {
            participantIds.add(participant.getAttribute("id"));
        }
        for (Element child : childElements(plane)) {
            if (participantIds.contains(child.getAttribute("bpmnElement"))) {
                plane.removeChild(child);
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static BoundsRect boundsOf(Map<String, Element> shapes, String elementId) {
        Element shape = shapes.get(elementId);
        return shape == null ? null : readBounds(shape);
    }

    private static Element createShape(Document doc, String id, String elementId) {
        Element shape = doc.createElementNS(BPMNDI_NS, qualified(BPMNDI_NS, "BPMNShape"));
        shape.setAttribute("id", id);
        shape.setAttribute("bpmnElement", elementId);
        shape.setAttribute("isHorizontal", "true");
        return shape;
    }

    private static Element createSequenceFlow(Document doc, SequenceFlow flow) {
        Element flowEl = doc.createElementNS(BPMN_NS, qualified(BPMN_NS, "sequenceFlow"));
        flowEl.setAttribute("id", flow.id());
        if (flow.name() != null) {
            flowEl.setAttribute("name", flow.name());
        }
        flowEl.setAttribute("sourceRef", flow.sourceRef());
        flowEl.setAttribute("targetRef", flow.targetRef());

        if (flow.conditionExpression() != null) {
            Element condition = doc.createElementNS(BPMN_NS, qualified(BPMN_NS, "conditionExpression"));
            condition.setAttributeNS(XSI_NS, qualified(XSI_NS, "type"), "bpmn:tFormalExpression");
            condition.setTextContent(flow.conditionExpression());
            flowEl.appendChild(condition);
        }
        return flowEl;
    }

    /**
     * Straight edge from the source's bottom to the target's top when the target lies lower,
     * otherwise from the source's top to the target's bottom.
     */
    private static Element createEdge(Document doc, String flowId, BoundsRect source, BoundsRect target) {
        Element edge = doc.createElementNS(BPMNDI_NS, qualified(BPMNDI_NS, "BPMNEdge"));
        edge.setAttribute("id", flowId + "_di");
        edge.setAttribute("bpmnElement", flowId);

        boolean downwards = source.y() < target.y();
        edge.appendChild(createWaypoint(doc, source.centerX(), downwards ? source.maxY() : source.y()));
        edge.appendChild(createWaypoint(doc, target.centerX(), downwards ? target.y() : target.maxY()));
        return edge;
    }

    private static Element createWaypoint(Document doc, double x, double y) {
        Element waypoint = doc.createElementNS(DI_NS, qualified(DI_NS, "waypoint"));
        waypoint.setAttribute("x", Long.toString(Math.round(x)));
        waypoint.setAttribute("y", Long.toString(Math.round(y)));
        return waypoint;
    }

    private static Element requireProcess(Document doc, String label) {
        Element process = BpmnDocumentHelper.findProcess(doc);
        if (process == null) {
            throw new MergeException(label + " has no process element");
        }
        return process;
    }

    private static Element requirePlane(Document doc, String label) {
        Element plane = BpmnDocumentHelper.findPlane(doc);
        if (plane == null) {
            throw new MergeException(label + " has no BPMNPlane element");
        }
        return plane;
    }

    private record ParsedFragment(String label, String laneId, Document doc, Element process, Element plane) {
    }

    private record ResolvedLane(Element laneSet, Element lane, Element shape, BoundsRect bounds) {
    }

    /**
     * The base document together with the running stacking position.
     */
    private static final class MergedDiagram {
        private final Document doc;
        private final Element process;
        private final Element plane;
        private final Element laneSet;
        private final BoundsRect base;
        private double currentY;
        private double currentHeight;
        private double maxWidth;
        private int laneCount = 1;

        MergedDiagram(ParsedFragment fragment, ResolvedLane lane) {
            this.doc = fragment.doc();
            this.process = fragment.process();
            this.plane = fragment.plane();
            this.laneSet = lane.laneSet();
            this.base = lane.bounds();
            this.currentY = base.y();
            this.currentHeight = base.height();
            this.maxWidth = base.width();
        }

        void append(ParsedFragment fragment, ResolvedLane lane) {
            BoundsRect bounds = lane.bounds();
            double newY = currentY + currentHeight;
            double xGap = bounds.x() - base.x();
            double yGap = bounds.y() - newY;
            maxWidth = Math.max(maxWidth, bounds.width());

            translate(fragment.plane(), -xGap, -yGap);
            writeBounds(lane.shape(), new BoundsRect(base.x(), newY, maxWidth, bounds.height()));

            laneSet.appendChild(doc.importNode(lane.lane(), true));
            for (Element child : childElements(fragment.process())) {
                if (!NON_FLOW_PROCESS_CHILDREN.contains(child.getLocalName())) {
                    process.appendChild(doc.importNode(child, true));
                }
            }
            for (Element child : childElements(fragment.plane())) {
                if (BPMNDI_NS.equals(child.getNamespaceURI())
                        && ("BPMNShape".equals(child.getLocalName()) || "BPMNEdge".equals(child.getLocalName()))) {
                    plane.appendChild(doc.importNode(child, true));
                }
            }

            currentY = newY;
            currentHeight = bounds.height();
            laneCount++;
        }

        void equalizeLaneWidths() {
            Map<String, Element> shapes = shapesByElementId(plane);
            for (Element lane : elements(laneSet, BPMN_NS, "lane")) {
                Element shape = shapes.get(lane.getAttribute("id"));
                BoundsRect bounds = shape == null ? null : readBounds(shape);
                if (bounds != null) {
                    writeBounds(shape, new BoundsRect(bounds.x(), bounds.y(), maxWidth, bounds.height()));
                }
            }
        }
    }
}
