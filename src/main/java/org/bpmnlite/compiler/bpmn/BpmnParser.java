package org.bpmnlite.compiler.bpmn;

import org.bpmnlite.compiler.bpmn.models.ConditionExpr;
import org.bpmnlite.compiler.bpmn.models.GatewayDirection;
import org.bpmnlite.compiler.bpmn.models.IREdge;
import org.bpmnlite.compiler.bpmn.models.IRGraph;
import org.bpmnlite.compiler.bpmn.models.IRNode;
import org.bpmnlite.compiler.bpmn.models.TimerKind;
import org.bpmnlite.compiler.bpmn.models.TimerSpec;
import org.bpmnlite.compiler.config.CompilerOptions;
import org.bpmnlite.compiler.errors.BpmnCompileException;
import org.bpmnlite.compiler.util.ConditionParser;
import org.bpmnlite.compiler.util.TimerSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a BPMN 2.0 document into an {@link IRGraph}.
 * <p>
 * The document is read into a DOM tree and walked depth-first as a stream of open and close tags.
 * Element and attribute names are matched on their local part, so {@code bpmn:startEvent},
 * {@code startEvent} and vendor names like {@code zeebe:taskDefinition} are all recognized.
 * Sequence flows are resolved into edges only after the whole document has been walked.
 */
public class BpmnParser {
    private static final Logger log = LoggerFactory.getLogger(BpmnParser.class);

    private static final Set<String> UNSUPPORTED_ELEMENTS = Set.of(
            "scriptTask", "businessRuleTask", "sendTask", "receiveTask", "manualTask",
            "subProcess", "callActivity", "eventBasedGateway", "complexGateway");

    static final String DEFAULT_CORRELATION_KEY = "0";

    private final CompilerOptions options;

    public BpmnParser() {
        this(CompilerOptions.defaults());
    }

    public BpmnParser(CompilerOptions options) {
        this.options = options;
    }

    /**
     * Parses a complete BPMN document.
     *
     * @param xml the whole document text
     * @return the workflow graph with every sequence flow resolved
     * @throws BpmnCompileException on malformed XML, unsupported elements, dangling references
     *                              or invalid timer literals
     */
    public IRGraph parse(String xml) {
        if (xml == null) {
            throw new IllegalArgumentException("BPMN document must not be null");
        }

        Document doc = readDocument(xml);
        ParseState state = new ParseState(collectErrorCodes(doc));
        walk(doc.getDocumentElement(), state);
        IRGraph graph = state.resolveFlows();

        log.debug("Parsed BPMN into {} nodes and {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private static Document readDocument(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            // Prefixes are stripped by hand, so undeclared vendor prefixes do not break the parse.
            factory.setNamespaceAware(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException e) {
                    log.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
                }

                @Override
                public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw BpmnCompileException.xmlSyntax("line " + e.getLineNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw BpmnCompileException.xmlSyntax(e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        }
    }

    /**
     * Collects definitions-level {@code <error id errorCode>} elements, wherever they appear in the document.
     */
    private static Map<String, String> collectErrorCodes(Document doc) {
        Map<String, String> errorCodes = new HashMap<>();
        NodeList all = doc.getElementsByTagName("*");
        for (int i = 0; i < all.getLength(); i++) {
            Element el = (Element) all.item(i);
            if (!"error".equals(localName(el.getTagName()))) {
                continue;
            }
            String id = attribute(el, "id");
            String code = attribute(el, "errorCode");
            if (id != null && code != null) {
                errorCodes.put(id, code);
            }
        }
        return errorCodes;
    }

    /**
     * Depth-first open/close traversal over an explicit stack of frames.
     */
    private void walk(Element root, ParseState state) {
        Deque<WalkFrame> stack = new ArrayDeque<>();
        stack.push(new WalkFrame(root, state));
        while (!stack.isEmpty()) {
            WalkFrame frame = stack.peek();
            Element next = frame.nextChildElement();
            if (next != null) {
                stack.push(new WalkFrame(next, state));
            } else {
                stack.pop();
                state.close(frame.local);
            }
        }
    }

    private static final class WalkFrame {
        private final String local;
        private final NodeList children;
        private int cursor;

        WalkFrame(Element element, ParseState state) {
            this.local = localName(element.getTagName());
            this.children = element.getChildNodes();
            state.open(local, element);
        }

        Element nextChildElement() {
            while (cursor < children.getLength()) {
                Node child = children.item(cursor++);
                if (child.getNodeType() == Node.ELEMENT_NODE) {
                    return (Element) child;
                }
            }
            return null;
        }
    }

    /**
     * Text directly under an element. Nested markup is not descended into.
     */
    static String directText(Element element) {
        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }
        return text.toString().trim();
    }

    /**
     * Strips a namespace prefix: "bpmn:startEvent" becomes "startEvent".
     */
    static String localName(String qualifiedName) {
        int pos = qualifiedName.lastIndexOf(':');
        return pos >= 0 ? qualifiedName.substring(pos + 1) : qualifiedName;
    }

    /**
     * Optional attribute lookup by local name; returns null when absent.
     */
    static String attribute(Element element, String name) {
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Node attr = attributes.item(i);
            String attrName = attr.getNodeName();
            if (attrName.startsWith("xmlns")) {
                continue;
            }
            if (localName(attrName).equals(name)) {
                return attr.getNodeValue();
            }
        }
        return null;
    }

    static String requiredAttribute(Element element, String local, String name) {
        String value = attribute(element, name);
        if (value == null) {
            throw BpmnCompileException.missingAttribute(local, name);
        }
        return value;
    }

    /**
     * "Create Case Record" becomes "create_case_record".
     */
    static String nameToSnake(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        return Arrays.stream(name.trim().split("\\s+"))
                .map(word -> word.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining("_"));
    }

    private record PendingFlow(String id, String source, String target, ConditionExpr condition) {
    }

    /**
     * Everything the tag handlers share while the document is walked.
     * The string id to index map only lives here and is dropped once flows are resolved.
     */
    private final class ParseState {
        private final IRGraph.Builder graph = IRGraph.builder();
        private final Map<String, Integer> nodeIndexById = new HashMap<>();
        private final List<PendingFlow> flows = new ArrayList<>();
        private final Map<String, String> errorCodes;
        private final Deque<String> openElements = new ArrayDeque<>();

        private boolean withinProcess;
        private ElementContext current;
        private String extensionTaskType;
        private String extensionCorrKey;
        private String conditionText;
        private boolean inExtensionElements;
        private EventDefinition eventDefinition;
        private String timerText;
        private TimerKind timerKind;

        ParseState(Map<String, String> errorCodes) {
            this.errorCodes = errorCodes;
        }

        void open(String local, Element e) {
            String parent = openElements.peek();
            openElements.push(local);

            if ("process".equals(local)) {
                withinProcess = true;
                return;
            }
            if (!withinProcess) {
                return;
            }

            if (UNSUPPORTED_ELEMENTS.contains(local)) {
                String id = Optional.ofNullable(attribute(e, "id")).orElse(local);
                throw BpmnCompileException.unsupportedElement(local, id);
            }

            switch (local) {
                case "startEvent" -> addNode(new IRNode.Start(requiredAttribute(e, local, "id")));
                case "endEvent" -> beginContext(new ElementContext.EndEvent(requiredAttribute(e, local, "id")));
                case "serviceTask" -> beginContext(new ElementContext.ServiceTask(
                        requiredAttribute(e, local, "id"), nameOf(e)));
                case "userTask" -> beginContext(new ElementContext.UserTask(
                        requiredAttribute(e, local, "id"), nameOf(e)));
                case "exclusiveGateway" -> addNode(new IRNode.GatewayXor(
                        requiredAttribute(e, local, "id"), nameOf(e)));
                case "parallelGateway" -> addNode(new IRNode.GatewayAnd(
                        requiredAttribute(e, local, "id"), nameOf(e),
                        GatewayDirection.fromAttribute(attribute(e, "gatewayDirection"))));
                case "inclusiveGateway" -> addNode(new IRNode.GatewayInclusive(
                        requiredAttribute(e, local, "id"), nameOf(e),
                        GatewayDirection.fromAttribute(attribute(e, "gatewayDirection"))));
                case "intermediateCatchEvent" -> beginContext(new ElementContext.IntermediateCatch(
                        requiredAttribute(e, local, "id"), nameOf(e)));
                case "boundaryEvent" -> {
                    String id = requiredAttribute(e, local, "id");
                    String attachedTo = requiredAttribute(e, local, "attachedToRef");
                    boolean cancelActivity = !"false".equals(attribute(e, "cancelActivity"));
                    beginContext(new ElementContext.BoundaryEvent(id, attachedTo, cancelActivity));
                }
                case "sequenceFlow" -> beginContext(new ElementContext.SequenceFlow(
                        requiredAttribute(e, local, "id"),
                        requiredAttribute(e, local, "sourceRef"),
                        requiredAttribute(e, local, "targetRef")));
                case "timerEventDefinition" -> recordEventDefinition(new EventDefinition.Timer(), parent);
                case "messageEventDefinition" -> recordEventDefinition(new EventDefinition.Message(), parent);
                case "terminateEventDefinition" -> recordEventDefinition(new EventDefinition.Terminate(), parent);
                case "errorEventDefinition" -> recordEventDefinition(
                        new EventDefinition.Error(attribute(e, "errorRef")), parent);
                case "timeDuration" -> recordTimer(TimerKind.DURATION, e);
                case "timeDate" -> recordTimer(TimerKind.DATE, e);
                case "timeCycle" -> recordTimer(TimerKind.CYCLE, e);
                case "conditionExpression" -> conditionText = directText(e);
                case "extensionElements" -> inExtensionElements = true;
                case "taskDefinition" -> {
                    if (inExtensionElements && attribute(e, "type") != null) {
                        extensionTaskType = attribute(e, "type");
                    }
                }
                case "subscription" -> {
                    String key = attribute(e, "correlationKey");
                    if (inExtensionElements && key != null) {
                        String stripped = key.startsWith("=") ? key.substring(1) : key;
                        extensionCorrKey = stripped.trim();
                    }
                }
                default -> {
                    // documentation, incoming/outgoing refs, DI and unknown vendor elements carry nothing we need
                }
            }
        }

        void close(String local) {
            openElements.pop();

            switch (local) {
                case "process" -> withinProcess = false;
                case "extensionElements" -> inExtensionElements = false;
                case "serviceTask" -> {
                    if (current instanceof ElementContext.ServiceTask ctx) {
                        String taskType = extensionTaskType != null ? extensionTaskType : nameToSnake(ctx.name());
                        addNode(new IRNode.ServiceTask(ctx.id(), ctx.name(), taskType));
                        endContext();
                    }
                }
                case "userTask" -> {
                    if (current instanceof ElementContext.UserTask ctx) {
                        String taskKind = extensionTaskType != null ? extensionTaskType : ctx.name();
                        addNode(new IRNode.HumanWait(ctx.id(), ctx.name(), taskKind, correlationKey()));
                        endContext();
                    }
                }
                case "intermediateCatchEvent" -> {
                    if (current instanceof ElementContext.IntermediateCatch ctx) {
                        finishIntermediateCatch(ctx);
                        endContext();
                    }
                }
                case "endEvent" -> {
                    if (current instanceof ElementContext.EndEvent ctx) {
                        boolean terminate = eventDefinition instanceof EventDefinition.Terminate;
                        addNode(new IRNode.End(ctx.id(), terminate));
                        endContext();
                    }
                }
                case "boundaryEvent" -> {
                    if (current instanceof ElementContext.BoundaryEvent ctx) {
                        finishBoundaryEvent(ctx);
                        endContext();
                    }
                }
                case "sequenceFlow" -> {
                    if (current instanceof ElementContext.SequenceFlow ctx) {
                        flows.add(new PendingFlow(ctx.id(), ctx.source(), ctx.target(), condition(ctx.id())));
                        endContext();
                    }
                }
                default -> {
                }
            }
        }

        private void finishIntermediateCatch(ElementContext.IntermediateCatch ctx) {
            String context = "intermediateCatchEvent '" + ctx.id() + "'";
            if (eventDefinition instanceof EventDefinition.Timer) {
                addNode(new IRNode.TimerWait(ctx.id(), timerSpec()));
            } else if (eventDefinition instanceof EventDefinition.Message) {
                addNode(new IRNode.MessageWait(ctx.id(), ctx.name(), correlationKey()));
            } else if (eventDefinition instanceof EventDefinition.Terminate) {
                throw BpmnCompileException.misplacedEventDefinition(
                        "terminateEventDefinition (only valid on endEvent)", context);
            } else if (eventDefinition instanceof EventDefinition.Error) {
                throw BpmnCompileException.misplacedEventDefinition(
                        "errorEventDefinition (only valid on boundaryEvent)", context);
            } else {
                throw BpmnCompileException.missingEventDefinition(ctx.id(), "timer or message");
            }
        }

        private void finishBoundaryEvent(ElementContext.BoundaryEvent ctx) {
            String context = "boundaryEvent '" + ctx.id() + "'";
            if (eventDefinition instanceof EventDefinition.Timer) {
                addNode(new IRNode.BoundaryTimer(ctx.id(), ctx.attachedTo(), timerSpec(), ctx.cancelActivity()));
            } else if (eventDefinition instanceof EventDefinition.Error error) {
                addNode(new IRNode.BoundaryError(ctx.id(), ctx.attachedTo(), resolveErrorCode(ctx.id(), error)));
            } else if (eventDefinition instanceof EventDefinition.Message) {
                throw BpmnCompileException.misplacedEventDefinition(
                        "messageEventDefinition (message boundary events are not supported)", context);
            } else if (eventDefinition instanceof EventDefinition.Terminate) {
                throw BpmnCompileException.misplacedEventDefinition(
                        "terminateEventDefinition (only valid on endEvent)", context);
            } else {
                throw BpmnCompileException.missingEventDefinition(ctx.id(), "timer or error");
            }
        }

        private String resolveErrorCode(String boundaryId, EventDefinition.Error error) {
            if (error.errorRef() == null) {
                return null;
            }
            String code = errorCodes.get(error.errorRef());
            if (code == null) {
                if (options.failOnUnresolvedErrorRef()) {
                    throw BpmnCompileException.unresolvedReference(boundaryId, "errorRef", error.errorRef());
                }
                log.warn("boundaryEvent '{}' references unknown errorRef '{}', compiling it as a catch-all",
                        boundaryId, error.errorRef());
            }
            return code;
        }

        private void recordEventDefinition(EventDefinition definition, String parent) {
            if ("startEvent".equals(parent)) {
                throw BpmnCompileException.misplacedEventDefinition(definition.elementName()
                        + " (only plain start events are supported)", "<startEvent>");
            }

            boolean eventContext = current instanceof ElementContext.IntermediateCatch
                    || current instanceof ElementContext.BoundaryEvent
                    || current instanceof ElementContext.EndEvent;

            if (!eventContext) {
                String where = "<" + parent + ">";
                if (definition instanceof EventDefinition.Terminate) {
                    throw BpmnCompileException.misplacedEventDefinition(
                            "terminateEventDefinition (only valid on endEvent)", where);
                }
                if (definition instanceof EventDefinition.Error) {
                    throw BpmnCompileException.misplacedEventDefinition(
                            "errorEventDefinition (only valid on boundaryEvent)", where);
                }
                log.debug("Ignoring {} inside {}", definition.elementName(), where);
                return;
            }

            if (eventDefinition != null) {
                throw BpmnCompileException.misplacedEventDefinition(definition.elementName()
                        + " (only one event definition allowed, already has "
                        + eventDefinition.elementName() + ")", "'" + current.id() + "'");
            }
            if (current instanceof ElementContext.EndEvent && !(definition instanceof EventDefinition.Terminate)) {
                throw BpmnCompileException.misplacedEventDefinition(definition.elementName()
                        + " (endEvent only takes terminateEventDefinition)", "endEvent '" + current.id() + "'");
            }
            eventDefinition = definition;
        }

        private void recordTimer(TimerKind kind, Element e) {
            timerKind = kind;
            timerText = directText(e);
        }

        private TimerSpec timerSpec() {
            return TimerSpecParser.parse(timerKind, timerText);
        }

        private ConditionExpr condition(String flowId) {
            if (conditionText == null || conditionText.isEmpty()) {
                return null;
            }
            Optional<ConditionExpr> parsed = ConditionParser.parse(conditionText);
            if (parsed.isEmpty()) {
                log.debug("Condition '{}' on sequenceFlow '{}' is not a supported comparison; "
                        + "treating the flow as unconditioned", conditionText, flowId);
            }
            return parsed.orElse(null);
        }

        private String correlationKey() {
            return extensionCorrKey != null ? extensionCorrKey : DEFAULT_CORRELATION_KEY;
        }

        private void beginContext(ElementContext context) {
            current = context;
            extensionTaskType = null;
            extensionCorrKey = null;
            conditionText = null;
            eventDefinition = null;
            timerText = null;
            timerKind = null;
        }

        private void endContext() {
            current = null;
            extensionTaskType = null;
            extensionCorrKey = null;
            conditionText = null;
            eventDefinition = null;
            timerText = null;
            timerKind = null;
        }

        private void addNode(IRNode node) {
            if (nodeIndexById.containsKey(node.id())) {
                throw BpmnCompileException.duplicateId(node.id());
            }
            nodeIndexById.put(node.id(), graph.addNode(node));
            log.debug("Added {} '{}'", node.getClass().getSimpleName(), node.id());
        }

        private String nameOf(Element e) {
            String name = attribute(e, "name");
            return name != null ? name : "";
        }

        IRGraph resolveFlows() {
            for (PendingFlow flow : flows) {
                Integer source = nodeIndexById.get(flow.source());
                if (source == null) {
                    throw BpmnCompileException.unresolvedReference(flow.id(), "sourceRef", flow.source());
                }
                Integer target = nodeIndexById.get(flow.target());
                if (target == null) {
                    throw BpmnCompileException.unresolvedReference(flow.id(), "targetRef", flow.target());
                }
                graph.addEdge(source, target, new IREdge(flow.id(), flow.condition()));
            }
            return graph.build();
        }
    }
}
