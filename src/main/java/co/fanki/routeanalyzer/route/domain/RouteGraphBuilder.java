package co.fanki.routeanalyzer.route.domain;

import co.fanki.routeanalyzer.script.domain.ScriptParseException;
import co.fanki.routeanalyzer.script.domain.Statement;
import co.fanki.routeanalyzer.script.domain.StatementKind;
import co.fanki.routeanalyzer.script.domain.StatementSource;
import co.fanki.routeanalyzer.shared.DomainException;
import co.fanki.routeanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link RouteGraph} from the statement records of a corpus.
 *
 * <p>Works in two passes. The first loads every file and declares every
 * label, so forward references and cross-file jumps resolve. The second
 * walks each label body and emits nodes and edges:</p>
 * <ul>
 *   <li>a label node per declaration, a menu node per menu, with the id
 *       {@code <label>_menu_<n>} counted in document order, suffixed
 *       with its location when a label already owns that id;</li>
 *   <li>{@code SEQUENCE} edges between consecutive nodes of a label, and
 *       from the end of a label into the next label of the same file
 *       when control falls through;</li>
 *   <li>{@code JUMP} and {@code CALL} edges from the enclosing node to
 *       the target label, a call keeping the flow alive;</li>
 *   <li>{@code CHOICE} edges from a menu to each resolved choice
 *       target.</li>
 * </ul>
 *
 * <p>Targets that name no declared label, and targets computed at runtime,
 * are routed to {@link RouteGraph#UNKNOWN_NODE_ID}. A file whose
 * statements cannot be loaded contributes nothing and is reported in the
 * outcome, the other files are still analyzed.</p>
 *
 * <p>Stateless; each call to {@link #build(StatementSource)} works on its
 * own data.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RouteGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            RouteGraphBuilder.class);

    /** Error code of a rebuild interrupted between two files. */
    public static final String CANCELLED = "ANALYSIS_CANCELLED";

    /**
     * Result of a build.
     *
     * @param graph the sealed route graph
     * @param labels every label declaration, in declaration order
     * @param failedFiles files that could not be tokenized
     */
    public record Outcome(RouteGraph graph, List<LabelDeclaration> labels,
            List<String> failedFiles) {

        /** Checks if some file's contribution is missing. */
        public boolean partial() {
            return !failedFiles.isEmpty();
        }
    }

    /**
     * Builds the route graph of every file of a source.
     *
     * @param source the statement source
     * @return the graph, the label declarations and the failed files
     * @throws co.fanki.routeanalyzer.script.domain
     *         .StatementSourceUnavailableException if the source is down
     * @throws DomainException with code {@link #CANCELLED} if the thread is
     *         interrupted between two files
     */
    public Outcome build(final StatementSource source) {
        Preconditions.requireNonNull(source, "Statement source is required");

        final List<String> filenames = source.filenames();
        LOG.info("Building route graph from {} script files",
                filenames.size());

        final Map<String, List<Statement>> loaded = new LinkedHashMap<>();
        final List<String> failed = new ArrayList<>();

        for (final String filename : filenames) {
            if (Thread.currentThread().isInterrupted()) {
                throw new DomainException("Route analysis cancelled",
                        CANCELLED);
            }
            try {
                loaded.put(filename, source.statements(filename));
            } catch (final ScriptParseException e) {
                LOG.warn("Skipping script file {}: {}", filename,
                        e.getMessage());
                failed.add(filename);
            }
        }

        final Build build = new Build();
        for (final Map.Entry<String, List<Statement>> file
                : loaded.entrySet()) {
            build.declareFile(file.getKey(), file.getValue());
        }
        final RouteGraph graph = build.walk();

        LOG.info("Route graph built: {} nodes, {} edges, {} unresolved"
                        + " targets, {} failed files",
                graph.nodeCount(), graph.edgeCount(),
                graph.unresolvedCount(), failed.size());

        return new Outcome(graph, List.copyOf(build.declarations),
                List.copyOf(failed));
    }

    /**
     * Normalizes a raw choice guard.
     *
     * @param condition the guard as written
     * @return the trimmed guard, or null for absent, blank and
     *         {@code True} guards
     */
    static String normalizeCondition(final String condition) {
        if (condition == null) {
            return null;
        }
        final String trimmed = condition.strip();
        if (trimmed.isEmpty() || "True".equals(trimmed)) {
            return null;
        }
        return trimmed;
    }

    /** A walked menu and whether control can leave it downwards. */
    private record MenuWalk(String id, boolean fallsThrough) {}

    /** Mutable state of one build. */
    private static final class Build {

        private final List<LabelDeclaration> declarations = new ArrayList<>();

        /** Qualified label name to the id of its first declaration. */
        private final Map<String, String> labelIds = new HashMap<>();

        private final Set<String> declaredIds = new HashSet<>();

        private final Map<Statement, LabelDeclaration> byStatement =
                new IdentityHashMap<>();

        /** Label id to the id of the label that follows it in its file. */
        private final Map<String, String> fallThrough = new HashMap<>();

        private final Map<Statement, String> menuIds =
                new IdentityHashMap<>();

        private final List<RouteNode> nodes = new ArrayList<>();

        private final List<RouteEdge> edges = new ArrayList<>();

        // -- pass 1 ----------------------------------------------------------

        private void declareFile(final String filename,
                final List<Statement> statements) {

            final List<LabelDeclaration> inFile = new ArrayList<>();
            String scope = null;

            for (final Statement statement : statements) {
                if (!statement.is(StatementKind.LABEL)) {
                    continue;
                }
                final LabelDeclaration declaration =
                        declare(statement, scope);
                scope = declaration.scope();
                inFile.add(declaration);

                for (final Statement child : statement.children()) {
                    if (child.is(StatementKind.LABEL)) {
                        inFile.add(declare(child, scope));
                    }
                }
            }

            for (int i = 0; i + 1 < inFile.size(); i++) {
                fallThrough.put(inFile.get(i).id(), inFile.get(i + 1).id());
            }
        }

        private LabelDeclaration declare(final Statement statement,
                final String currentScope) {

            final String raw = statement.name();
            final boolean local = raw.startsWith(".");
            final String name;
            final String scope;
            if (local && currentScope != null) {
                name = currentScope + raw;
                scope = currentScope;
            } else if (local) {
                name = raw.substring(1);
                scope = name;
            } else {
                name = raw;
                scope = raw.contains(".")
                        ? raw.substring(0, raw.indexOf('.'))
                        : raw;
            }

            String id = name;
            if (labelIds.containsKey(name)) {
                id = name + "@" + statement.location();
                LOG.warn("Label {} declared again at {}, registered as {}",
                        name, statement.location(), id);
            } else {
                labelIds.put(name, id);
            }

            final LabelDeclaration declaration = new LabelDeclaration(id,
                    name, scope, statement.filename(), statement.line(),
                    statement.children());
            declarations.add(declaration);
            declaredIds.add(id);
            byStatement.put(statement, declaration);
            return declaration;
        }

        // -- pass 2 ----------------------------------------------------------

        private RouteGraph walk() {
            for (final LabelDeclaration declaration : declarations) {
                walkLabel(declaration);
            }

            final RouteGraph graph = new RouteGraph();
            nodes.forEach(graph::addNode);
            edges.forEach(graph::addEdge);
            graph.seal();
            return graph;
        }

        private void walkLabel(final LabelDeclaration label) {
            nodes.add(RouteNode.label(label.id(), label.name(),
                    label.filename(), label.line()));
            numberMenus(label, label.body(), new int[] {0});

            final String next = fallThrough.get(label.id());
            final String chain = walkBody(label, label.body(), 0, label.id(),
                    label.id(), next);

            if (chain != null && next != null) {
                edges.add(RouteEdge.sequence(chain, next));
            }
        }

        /** Assigns menu ids in document order, skipping nested labels. */
        private void numberMenus(final LabelDeclaration label,
                final List<Statement> body, final int[] counter) {
            for (final Statement statement : body) {
                if (statement.is(StatementKind.LABEL)) {
                    continue;
                }
                if (statement.is(StatementKind.MENU)) {
                    counter[0]++;
                    String id = label.id() + "_menu_" + counter[0];
                    if (declaredIds.contains(id)) {
                        id = id + "@" + statement.location();
                        LOG.warn("Menu id {} is taken by a label, registered"
                                + " as {}", label.id() + "_menu_"
                                + counter[0], id);
                    }
                    menuIds.put(statement, id);
                }
                numberMenus(label, statement.children(), counter);
            }
        }

        /**
         * Walks a statement list and emits its nodes and edges.
         *
         * @param label the enclosing label
         * @param body the statements
         * @param from the first index to walk
         * @param chain the node control currently flows from, null when
         *        the flow was terminated
         * @param source the node transfers are attributed to
         * @param outer where control goes after the last statement
         * @return the node control flows from after the list, or null
         */
        private String walkBody(final LabelDeclaration label,
                final List<Statement> body, final int from,
                final String chain, final String source,
                final String outer) {

            String current = chain;
            for (int i = from; i < body.size(); i++) {
                final Statement statement = body.get(i);
                switch (statement.kind()) {
                    case MENU -> {
                        final MenuWalk menu = walkMenu(label, statement,
                                continuation(label, body, i + 1, outer));
                        if (current != null) {
                            edges.add(RouteEdge.sequence(current, menu.id()));
                        }
                        current = menu.fallsThrough() ? menu.id() : null;
                    }
                    case JUMP -> {
                        edges.add(RouteEdge.jump(source,
                                resolve(label, statement)));
                        current = null;
                    }
                    case CALL -> edges.add(RouteEdge.call(source,
                            resolve(label, statement)));
                    case RETURN -> current = null;
                    case BLOCK -> walkBody(label, statement.children(), 0,
                            current, source,
                            continuation(label, body, i + 1, outer));
                    case LABEL -> {
                        final LabelDeclaration nested =
                                byStatement.get(statement);
                        if (nested != null && current != null) {
                            edges.add(RouteEdge.sequence(current,
                                    nested.id()));
                        }
                        current = null;
                    }
                    default -> {
                        // dialogue and unmodeled statements carry no flow
                    }
                }
            }
            return current;
        }

        /**
         * Emits a menu node with its choices and their edges.
         *
         * <p>A choice targets the first statement of its body that moves
         * control: a jump or call target, a nested menu, or nothing for a
         * return. A body without one continues after the menu. A menu
         * falls through when it has no choice or when some choice body
         * does not end in a jump or a return.</p>
         */
        private MenuWalk walkMenu(final LabelDeclaration label,
                final Statement menu, final String continuation) {

            final String menuId = menuIds.get(menu);
            final List<Choice> choices = new ArrayList<>();
            boolean fallsThrough = false;
            int index = 0;

            for (final Statement entry : menu.children()) {
                if (!entry.is(StatementKind.CHOICE)) {
                    continue;
                }
                final List<Statement> body = entry.children();
                final String target = continuation(label, body, 0,
                        continuation);
                final int transfer = firstTransfer(body);

                final String end;
                if (transfer < 0) {
                    end = walkBody(label, body, 0, menuId, menuId,
                            continuation);
                } else if (body.get(transfer).is(StatementKind.JUMP)
                        || body.get(transfer).is(StatementKind.CALL)) {
                    walkBody(label, body.subList(0, transfer), 0, menuId,
                            menuId, target);
                    end = walkBody(label, body, transfer + 1,
                            body.get(transfer).is(StatementKind.CALL)
                                    ? menuId : null,
                            menuId, continuation);
                } else {
                    end = walkBody(label, body, 0, null, menuId,
                            continuation);
                }
                fallsThrough |= end != null;

                choices.add(new Choice(index, entry.text(),
                        normalizeCondition(entry.condition()), target));
                if (target != null) {
                    edges.add(RouteEdge.choice(menuId, target, index,
                            entry.text()));
                }
                index++;
            }

            nodes.add(RouteNode.menu(menuId, label.name(), menu.filename(),
                    menu.line(), choices));
            return new MenuWalk(menuId, choices.isEmpty() || fallsThrough);
        }

        /** Index of the first top-level statement that moves control. */
        private int firstTransfer(final List<Statement> body) {
            for (int i = 0; i < body.size(); i++) {
                switch (body.get(i).kind()) {
                    case MENU, JUMP, CALL, RETURN, LABEL -> {
                        return i;
                    }
                    default -> {
                        // keep looking
                    }
                }
            }
            return -1;
        }

        /**
         * Finds where control goes once the statement before {@code from}
         * completes.
         */
        private String continuation(final LabelDeclaration label,
                final List<Statement> body, final int from,
                final String outer) {

            for (int i = from; i < body.size(); i++) {
                final Statement statement = body.get(i);
                switch (statement.kind()) {
                    case MENU:
                        return menuIds.get(statement);
                    case JUMP:
                    case CALL:
                        return resolve(label, statement);
                    case RETURN:
                        return null;
                    case LABEL:
                        final LabelDeclaration nested =
                                byStatement.get(statement);
                        return nested == null ? null : nested.id();
                    default:
                        break;
                }
            }
            return outer;
        }

        private String resolve(final LabelDeclaration label,
                final Statement transfer) {
            if (transfer.name() == null) {
                LOG.debug("Computed {} target at {}",
                        transfer.kind(), transfer.location());
                return RouteGraph.UNKNOWN_NODE_ID;
            }
            final String id = labelIds.get(label.qualify(transfer.name()));
            if (id == null) {
                LOG.debug("Unresolved {} target {} at {}", transfer.kind(),
                        transfer.name(), transfer.location());
                return RouteGraph.UNKNOWN_NODE_ID;
            }
            return id;
        }
    }

}
