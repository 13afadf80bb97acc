package com.flowlayout.flowlayout_backend.parser;

import com.flowlayout.flowlayout_backend.model.domain.ClassStyle;
import com.flowlayout.flowlayout_backend.model.domain.DiagramEdge;
import com.flowlayout.flowlayout_backend.model.domain.DiagramGraph;
import com.flowlayout.flowlayout_backend.model.domain.DiagramNode;
import com.flowlayout.flowlayout_backend.model.domain.NodeKind;
import com.flowlayout.flowlayout_backend.model.domain.Provider;
import com.flowlayout.flowlayout_backend.model.domain.Subgraph;
import com.flowlayout.flowlayout_backend.normalize.ComponentTypeCanonicalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-oriented flow-description parser.
 *
 * <pre>
 * flowchart LR
 * classDef laneBadge fill:#7C3AED,stroke:#5B21B6,color:#fff
 * group path_1a["1a - Kafka Path"]
 *     kafka[Kafka] --> pipe[Snowpipe] -->|load| raw[(Raw Table)]
 * end
 * badge_1a(["1a"]):::laneBadge
 * badge_1a ~~~ path_1a
 * </pre>
 *
 * Every line is tried against {@link #RULES} in order and the first rule that
 * accepts it wins. Lines no rule accepts are skipped with a warning. All parse
 * state lives in a {@link ParseState} created per call.
 */
@Slf4j
@Component
public class DiagramParser {

    private static final Pattern DIRECTIVE = Pattern.compile(
            "^(?:flowchart\\b|graph\\b|%%|style\\s|class\\s|linkStyle\\s|direction\\s|click\\s)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CLASS_DEF = Pattern.compile("^classDef\\s+([\\w-]+)\\s+(.+)$");
    private static final Pattern CLASS_DEF_NAME_ONLY = Pattern.compile("^classDef\\s+([\\w-]+)\\s*$");
    private static final Pattern STYLE_LINE = Pattern.compile("^fill:#\\w+");
    private static final Pattern FILL = Pattern.compile("fill:(#\\w+)");
    private static final Pattern STROKE = Pattern.compile("stroke:(#\\w+)");
    // Negative lookbehind keeps "stroke-color" and "fill" from matching as "color"
    private static final Pattern COLOR = Pattern.compile("(?<![\\w-])color:(#\\w+)");
    private static final Pattern GROUP_OPEN = Pattern.compile(
            "^(?:subgraph|group)\\s+([\\w-]+)\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUP_END = Pattern.compile("^end\\s*;?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INVISIBLE_LINK = Pattern.compile("^([\\w-]+)\\s*~~~\\s*([\\w-]+)\\s*;?$");

    // "-- label -->" | "-->", "--->", "-.->", "==>", "---", "-.-" with optional "|label|"
    private static final Pattern ARROW = Pattern.compile(
            "\\s*(?:--\\s+([^|>]+?)\\s+-->|(?:-{2,}>|-\\.+->|={2,}>|-{3,}|-\\.+-)\\s*(?:\\|([^|]*)\\|)?)\\s*");

    // id, optional shape ("[..]", "(..)", "([..])", "[(..)]", "((..))", "{..}"), optional ":::class"
    private static final Pattern NODE_REF = Pattern.compile(
            "^([\\w-]*)\\s*(\\[.*]|\\(.*\\)|\\{.*})?\\s*(?::::([\\w-]+))?\\s*;?$");

    private static final List<LineRule> RULES = List.of(
            new LineRule("directive", ParseState::skipDirective),
            new LineRule("classDef", ParseState::readClassDef),
            new LineRule("classDefStyle", ParseState::readPendingClassStyle),
            new LineRule("groupOpen", ParseState::openGroup),
            new LineRule("groupEnd", ParseState::closeGroup),
            new LineRule("invisibleLink", ParseState::readInvisibleLink),
            new LineRule("edge", ParseState::readEdgeChain),
            new LineRule("node", ParseState::readNodeDeclaration)
    );

    public DiagramGraph parse(String source) {
        String text = TextCleaner.unescape(source);
        List<String> lines = new ArrayList<>();
        for (String raw : text.split("\n")) {
            String line = raw.trim();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }

        ParseState state = new ParseState(collectDeclaredLabels(lines));
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            state.stylePendingFor = state.pendingClass;
            state.pendingClass = null;

            boolean consumed = false;
            for (LineRule rule : RULES) {
                if (rule.apply().test(state, line)) {
                    consumed = true;
                    break;
                }
            }
            if (!consumed) {
                state.warn("Skipped unrecognized line " + (i + 1) + ": " + line);
            }
        }
        if (!state.groupStack.isEmpty()) {
            log.debug("{} group block(s) still open at end of input, closing them", state.groupStack.size());
        }
        state.applyInvisibleLinks();

        log.debug("Parsed {} node declarations, {} edges, {} groups, {} class styles",
                state.declarations.size(), state.edges.size(), state.subgraphs.size(), state.classStyles.size());

        return DiagramGraph.builder()
                .nodes(state.declarations)
                .edges(state.edges)
                .subgraphs(new ArrayList<>(state.subgraphs.values()))
                .classStyles(state.classStyles)
                .warnings(state.warnings)
                .build();
    }

    /**
     * First explicit label per raw id, so a node referenced before its declaration
     * still gets its label (and boundary id) the moment it is created.
     */
    private static Map<String, String> collectDeclaredLabels(List<String> lines) {
        Map<String, String> labels = new HashMap<>();
        for (String line : lines) {
            if (DIRECTIVE.matcher(line).find() || line.startsWith("classDef")
                    || GROUP_OPEN.matcher(line).matches() || GROUP_END.matcher(line).matches()
                    || INVISIBLE_LINK.matcher(line).matches()) {
                continue;
            }
            EdgeChain chain = splitChain(line);
            List<NodeRef> refs = new ArrayList<>();
            if (chain != null) {
                chain.refs().forEach(r -> { if (r != null) refs.add(r); });
            } else {
                parseRef(line).ifPresent(refs::add);
            }
            for (NodeRef ref : refs) {
                if (ref.label() != null && TextCleaner.isValidId(ref.id())) {
                    labels.putIfAbsent(ref.id(), ref.label());
                }
            }
        }
        return labels;
    }

    static Optional<NodeRef> parseRef(String segment) {
        Matcher m = NODE_REF.matcher(segment.trim());
        if (!m.matches()) {
            return Optional.empty();
        }
        String label = m.group(2) != null ? TextCleaner.cleanLabel(stripShape(m.group(2))) : null;
        if (label != null && label.isEmpty()) {
            label = null;
        }
        return Optional.of(new NodeRef(m.group(1), label, m.group(3)));
    }

    /** "([Label])" → "Label"; at most two delimiter layers. */
    private static String stripShape(String shape) {
        String s = shape.trim();
        for (int layer = 0; layer < 2 && s.length() >= 2; layer++) {
            char first = s.charAt(0);
            char last = s.charAt(s.length() - 1);
            if ("[({".indexOf(first) >= 0 && "])}".indexOf(last) >= 0) {
                s = s.substring(1, s.length() - 1).trim();
            } else {
                break;
            }
        }
        return s;
    }

    /**
     * Splits "a[x] --> b -->|y| c" into endpoint refs and per-hop labels. Arrows
     * inside brackets, quotes or pipes do not split. Returns null when the line
     * holds no arrow. A ref is null where the segment is not a node reference.
     */
    static EdgeChain splitChain(String line) {
        String masked = mask(line);
        Matcher m = ARROW.matcher(masked);
        List<NodeRef> refs = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        int cursor = 0;
        boolean found = false;
        while (m.find()) {
            // An arrow must sit between two segments
            if (m.start() == 0 && !found) {
                refs.add(null);
            } else {
                refs.add(parseRef(line.substring(cursor, m.start())).orElse(null));
            }
            String label = null;
            if (m.group(1) != null) {
                label = line.substring(m.start(1), m.end(1));
            } else if (m.group(2) != null) {
                label = line.substring(m.start(2), m.end(2));
            }
            labels.add(label != null && !TextCleaner.cleanLabel(label).isEmpty() ? TextCleaner.cleanLabel(label) : null);
            cursor = m.end();
            found = true;
        }
        if (!found) {
            return null;
        }
        refs.add(parseRef(line.substring(cursor)).orElse(null));
        return new EdgeChain(refs, labels);
    }

    /** Replaces characters inside [], (), {}, quotes and |pipes| with 'x', keeping the delimiters. */
    private static String mask(String line) {
        StringBuilder sb = new StringBuilder(line.length());
        int depth = 0;
        boolean quoted = false;
        boolean piped = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            boolean inside = depth > 0 || quoted || piped;
            if (c == '"' && depth == 0 && !piped) {
                quoted = !quoted;
                sb.append(c);
            } else if (c == '|' && depth == 0 && !quoted) {
                piped = !piped;
                sb.append(c);
            } else if ("[({".indexOf(c) >= 0 && !quoted && !piped) {
                depth++;
                sb.append(c);
            } else if ("])}".indexOf(c) >= 0 && !quoted && !piped && depth > 0) {
                depth--;
                sb.append(c);
            } else {
                sb.append(inside ? 'x' : c);
            }
        }
        return sb.toString();
    }

    record NodeRef(String id, String label, String styleClass) {}

    record EdgeChain(List<NodeRef> refs, List<String> labels) {}

    private record LineRule(String name, BiPredicate<ParseState, String> apply) {}

    private record GroupFrame(String id, Provider provider) {}

    /** Mutable state of one parse call. */
    private static final class ParseState {

        private final Map<String, String> declaredLabels;

        private final List<DiagramNode> declarations = new ArrayList<>();
        private final Map<String, DiagramNode> nodesById = new LinkedHashMap<>();
        private final Set<String> explicitlyDeclared = new HashSet<>();
        private final List<DiagramEdge> edges = new ArrayList<>();
        private final Map<String, Subgraph> subgraphs = new LinkedHashMap<>();
        private final Deque<GroupFrame> groupStack = new ArrayDeque<>();
        private final Map<String, ClassStyle> classStyles = new LinkedHashMap<>();
        private final Map<String, String> invisibleLinks = new LinkedHashMap<>();
        private final List<String> warnings = new ArrayList<>();

        private String pendingClass;
        private String stylePendingFor;

        ParseState(Map<String, String> declaredLabels) {
            this.declaredLabels = declaredLabels;
        }

        void warn(String message) {
            log.debug("[Parser] {}", message);
            warnings.add(message);
        }

        // ── Rules ──────────────────────────────────────────────────────────

        boolean skipDirective(String line) {
            return DIRECTIVE.matcher(line).find();
        }

        boolean readClassDef(String line) {
            Matcher m = CLASS_DEF.matcher(line);
            if (m.matches()) {
                classStyles.put(m.group(1), parseStyle(m.group(2)));
                return true;
            }
            Matcher nameOnly = CLASS_DEF_NAME_ONLY.matcher(line);
            if (nameOnly.matches()) {
                pendingClass = nameOnly.group(1);
                return true;
            }
            return false;
        }

        boolean readPendingClassStyle(String line) {
            if (stylePendingFor == null || !STYLE_LINE.matcher(line).find()) {
                return false;
            }
            classStyles.put(stylePendingFor, parseStyle(line));
            return true;
        }

        boolean openGroup(String line) {
            Matcher m = GROUP_OPEN.matcher(line);
            if (!m.matches()) {
                return false;
            }
            String id = m.group(1);
            String rest = m.group(2).trim();
            String cleaned = rest.isEmpty() ? "" : TextCleaner.cleanLabel(stripShape(rest));
            String label = cleaned.isEmpty() ? id : cleaned;
            GroupFrame parent = groupStack.peek();

            Optional<Provider> perimeter = Provider.fromPerimeterText(id + " " + label);
            perimeter.ifPresent(p -> declareBoundary(p, label));
            // Nested groups inherit the enclosing perimeter
            Provider provider = perimeter.orElse(parent != null ? parent.provider() : null);

            if (!subgraphs.containsKey(id)) {
                subgraphs.put(id, Subgraph.builder()
                        .id(id)
                        .label(label)
                        .parent(parent != null ? parent.id() : null)
                        .build());
            } else {
                warn("Group '" + id + "' opened twice; members merged into the first block");
            }
            groupStack.push(new GroupFrame(id, provider));
            return true;
        }

        boolean closeGroup(String line) {
            if (!GROUP_END.matcher(line).matches()) {
                return false;
            }
            // Unbalanced "end" lines are tolerated
            if (!groupStack.isEmpty()) {
                groupStack.pop();
            }
            return true;
        }

        boolean readInvisibleLink(String line) {
            Matcher m = INVISIBLE_LINK.matcher(line);
            if (!m.matches()) {
                return false;
            }
            invisibleLinks.put(m.group(1), m.group(2));
            return true;
        }

        boolean readEdgeChain(String line) {
            EdgeChain chain = splitChain(line);
            if (chain == null) {
                return false;
            }
            List<DiagramNode> endpoints = new ArrayList<>();
            for (NodeRef ref : chain.refs()) {
                if (ref == null || !TextCleaner.isValidId(ref.id())) {
                    endpoints.add(null);
                    continue;
                }
                endpoints.add(ref.label() != null || ref.styleClass() != null
                        ? declare(ref)
                        : reference(ref.id()));
            }
            for (int i = 0; i + 1 < endpoints.size(); i++) {
                DiagramNode source = endpoints.get(i);
                DiagramNode target = endpoints.get(i + 1);
                if (source == null || target == null) {
                    warn("Skipped edge with invalid endpoint in: " + line);
                    continue;
                }
                edges.add(DiagramEdge.builder()
                        .id(source.getId() + "-" + target.getId() + "-" + edges.size())
                        .source(source.getId())
                        .target(target.getId())
                        .label(chain.labels().get(i))
                        .build());
            }
            return true;
        }

        boolean readNodeDeclaration(String line) {
            Optional<NodeRef> ref = parseRef(line);
            if (ref.isEmpty()) {
                return false;
            }
            if (!TextCleaner.isValidId(ref.get().id())) {
                warn("Dropped node with invalid id: '" + line + "'");
                return true;
            }
            declare(ref.get());
            return true;
        }

        // ── Node bookkeeping ───────────────────────────────────────────────

        /** Explicit declaration: a repeat of an already declared id is kept for the normalizer to drop. */
        private DiagramNode declare(NodeRef ref) {
            String label = ref.label() != null ? ref.label() : declaredLabels.getOrDefault(ref.id(), ref.id());
            String id = canonicalId(ref.id(), label);
            DiagramNode existing = nodesById.get(id);

            if (existing != null && !explicitlyDeclared.contains(id)) {
                // Created implicitly by an earlier edge; this is its first real declaration
                explicitlyDeclared.add(id);
                if (ref.styleClass() != null) {
                    applyStyleClass(existing, ref.styleClass());
                }
                attachToCurrentGroup(existing);
                return existing;
            }

            DiagramNode node = newNode(ref.id(), id, label, ref.styleClass());
            if (existing == null) {
                nodesById.put(id, node);
            }
            explicitlyDeclared.add(id);
            declarations.add(node);
            attachToCurrentGroup(node);
            return existing != null ? existing : node;
        }

        /** Bare id inside an edge. */
        private DiagramNode reference(String rawId) {
            String label = declaredLabels.getOrDefault(rawId, rawId);
            String id = canonicalId(rawId, label);
            DiagramNode existing = nodesById.get(id);
            if (existing != null) {
                if (existing.getSubgraph() == null) {
                    attachToCurrentGroup(existing);
                }
                return existing;
            }
            DiagramNode node = newNode(rawId, id, label, null);
            nodesById.put(id, node);
            declarations.add(node);
            attachToCurrentGroup(node);
            return node;
        }

        private void declareBoundary(Provider provider, String label) {
            String id = provider.canonicalId();
            DiagramNode node = DiagramNode.builder()
                    .id(id)
                    .label(label)
                    .componentType(id)
                    .kind(NodeKind.BOUNDARY)
                    .build();
            nodesById.putIfAbsent(id, node);
            explicitlyDeclared.add(id);
            declarations.add(node);
        }

        private DiagramNode newNode(String rawId, String id, String label, String styleClass) {
            boolean boundary = !id.equals(rawId);
            DiagramNode node = DiagramNode.builder()
                    .id(id)
                    .label(label)
                    .componentType(boundary ? id : ComponentTypeCanonicalizer.fromLabel(label))
                    .kind(boundary ? NodeKind.BOUNDARY : NodeKind.COMPONENT)
                    .build();
            if (styleClass != null) {
                applyStyleClass(node, styleClass);
            }
            return node;
        }

        private static String canonicalId(String rawId, String label) {
            return Provider.fromPerimeterText(rawId + " " + label)
                    .map(Provider::canonicalId)
                    .orElse(rawId);
        }

        private static void applyStyleClass(DiagramNode node, String styleClass) {
            node.setStyleClass(styleClass);
            if (!node.isBoundaryNode() && styleClass.toLowerCase().contains("badge")) {
                node.setKind(NodeKind.ANNOTATION);
            }
        }

        private void attachToCurrentGroup(DiagramNode node) {
            GroupFrame frame = groupStack.peek();
            if (frame == null || node.isBoundaryNode()) {
                return;
            }
            if (node.getSubgraph() == null) {
                node.setSubgraph(frame.id());
                subgraphs.get(frame.id()).getMembers().add(node.getId());
            }
            if (frame.provider() != null && node.getBoundary() == null) {
                node.setBoundary(frame.provider().key());
            }
        }

        /** "badge ~~~ group" moves the badge into the group; "badge ~~~ node" joins the node's group. */
        void applyInvisibleLinks() {
            invisibleLinks.forEach((sourceId, targetId) -> {
                DiagramNode source = nodesById.get(sourceId);
                if (source == null) {
                    warn("Invisible link from unknown node '" + sourceId + "' ignored");
                    return;
                }
                String groupId = subgraphs.containsKey(targetId)
                        ? targetId
                        : Optional.ofNullable(nodesById.get(targetId)).map(DiagramNode::getSubgraph).orElse(null);
                if (groupId == null) {
                    warn("Invisible link target '" + targetId + "' is neither a group nor a grouped node");
                    return;
                }
                if (source.getSubgraph() != null && subgraphs.containsKey(source.getSubgraph())) {
                    subgraphs.get(source.getSubgraph()).getMembers().remove(sourceId);
                }
                source.setSubgraph(groupId);
                List<String> members = subgraphs.get(groupId).getMembers();
                if (!members.contains(sourceId)) {
                    members.add(sourceId);
                }
            });
        }

        private static ClassStyle parseStyle(String styleList) {
            return new ClassStyle(
                    firstGroup(FILL, styleList),
                    firstGroup(STROKE, styleList),
                    firstGroup(COLOR, styleList));
        }

        private static String firstGroup(Pattern pattern, String text) {
            Matcher m = pattern.matcher(text);
            return m.find() ? m.group(1) : null;
        }
    }
}
