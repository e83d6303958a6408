package io.nodewright.core.batch;

import io.nodewright.core.edit.EditResult;
import io.nodewright.core.edit.GraphEditor;
import io.nodewright.core.edit.ValueParser;
import io.nodewright.core.exception.BatchScriptException;
import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WorkflowDocument;
import io.nodewright.core.schema.SlotDeclaration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Runs batch scripts against a document, one line at a time.
///
/// ### Supported lines
/// ```
/// copy <id|$v> [as $name] [key=value ...] [title="..."]
/// create <Type> [as $name] [-i name:TYPE ...] [-O name:TYPE ...] [key=value ...]
/// wire <src>:<slot> -> <dst>:<slot>
/// set <id|$v> key=value ...
/// delete <id|$v> ... [--cascade]
/// disconnect <id|$v>
/// inline
/// find <typePattern> as $name
/// ```
///
/// Lines execute strictly in order. The first failing line stops the run;
/// earlier lines stay applied. A dry run executes the same lines against a
/// copy and reports the effects without returning the edited document.
///
/// @implNote Stateless. Bindings live in a {@link ScriptEnvironment} created
/// per run.
public final class BatchInterpreter {

    private static final Logger logger = Logger.getLogger(BatchInterpreter.class.getName());

    private final GraphEditor editor;

    public BatchInterpreter(GraphEditor editor) {
        this.editor = Objects.requireNonNull(editor, "editor must not be null");
    }

    /// Parses and runs a script.
    ///
    /// @param document starting document, not null
    /// @param script script text, not null
    /// @param dryRun report effects without keeping them
    /// @return the run's outcome, never null
    /// @throws BatchScriptException if the script cannot be tokenized
    public BatchResult run(WorkflowDocument document, String script, boolean dryRun)
            throws BatchScriptException {
        return run(document, BatchParser.parse(script), dryRun);
    }

    /// Runs already parsed lines.
    ///
    /// Errors raised by a line are captured in {@link BatchResult#failure()}
    /// rather than thrown.
    ///
    /// @param document starting document, not null
    /// @param lines parsed lines, not null
    /// @param dryRun report effects without keeping them
    /// @return the run's outcome, never null
    public BatchResult run(WorkflowDocument document, List<ScriptLine> lines, boolean dryRun) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(lines, "lines must not be null");

        ScriptEnvironment environment = new ScriptEnvironment();
        RunState state = new RunState(dryRun ? document.copy() : document);
        BatchFailure failure = null;
        int executed = 0;
        for (ScriptLine line : lines) {
            try {
                execute(line, environment, state);
                executed++;
            } catch (WorkflowGraphException e) {
                logger.warning("Batch aborted at line " + line.number() + ": " + e.getMessage());
                failure = new BatchFailure(line.number(), line.text(), e);
                break;
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Batch aborted at line " + line.number(), e);
                BatchScriptException wrapped =
                        new BatchScriptException(line.number(), String.valueOf(e.getMessage()));
                wrapped.initCause(e);
                failure = new BatchFailure(line.number(), line.text(), wrapped);
                break;
            }
        }
        logger.info(
                "Batch "
                        + (dryRun ? "dry run " : "")
                        + "executed "
                        + executed
                        + " of "
                        + lines.size()
                        + " line(s)");
        return new BatchResult(
                dryRun ? document : state.document,
                dryRun,
                executed,
                environment.bindings(),
                state.edits,
                state.details,
                state.warnings,
                failure);
    }

    private void execute(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws WorkflowGraphException {
        switch (line.verb()) {
            case "copy" -> copy(line, environment, state);
            case "create" -> create(line, environment, state);
            case "wire" -> wire(line, environment, state);
            case "set" -> set(line, environment, state);
            case "delete" -> delete(line, environment, state);
            case "disconnect" -> disconnect(line, environment, state);
            case "inline" -> inline(line, state);
            case "find" -> find(line, environment, state);
            default -> throw new BatchScriptException(
                    line.number(), "unknown operation '" + line.verb() + "'");
        }
    }

    private void copy(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws WorkflowGraphException {
        List<String> args = line.args();
        if (args.isEmpty()) {
            throw new BatchScriptException(line.number(), "copy requires a node id");
        }
        NodeId source = environment.resolve(args.get(0), line.number());
        Options options = Options.parse(line, args.subList(1, args.size()));
        String title = options.title();
        EditResult result = editor.copy(state.document, source, title, options.values);
        NodeId created = result.createdNode().orElseThrow();
        state.apply(line, result);
        state.details.add("copy: " + source + " -> " + bind(environment, options.name, created));
    }

    private void create(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws WorkflowGraphException {
        List<String> args = line.args();
        if (args.isEmpty()) {
            throw new BatchScriptException(line.number(), "create requires a node type");
        }
        String type = args.get(0);
        Options options = Options.parse(line, args.subList(1, args.size()));
        String title = options.title();
        EditResult result =
                editor.create(
                        state.document,
                        type,
                        title,
                        options.inputs,
                        options.outputs,
                        options.values);
        NodeId created = result.createdNode().orElseThrow();
        state.apply(line, result);
        state.details.add("create: " + type + " -> " + bind(environment, options.name, created));
    }

    private void wire(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws WorkflowGraphException {
        String joined = String.join(" ", line.args()).replace("->", " ").replace("→", " ");
        String[] parts = joined.trim().split("\\s+");
        if (parts.length != 2 || parts[0].isEmpty()) {
            throw new BatchScriptException(
                    line.number(), "wire requires 'src:slot -> dst:slot'");
        }
        String[] source = endpoint(line, parts[0]);
        String[] target = endpoint(line, parts[1]);
        NodeId sourceId = environment.resolve(source[0], line.number());
        NodeId targetId = environment.resolve(target[0], line.number());
        EditResult result = editor.wire(state.document, sourceId, source[1], targetId, target[1]);
        state.apply(line, result);
        if (result.createdLinks().isEmpty()) {
            state.details.add("wire: [" + sourceId + "] -> [" + targetId + "] already connected");
        } else {
            state.details.add("wire: " + result.createdLinks().get(0).endpoints());
        }
    }

    private static String[] endpoint(ScriptLine line, String spec) throws BatchScriptException {
        int colon = spec.indexOf(':');
        if (colon <= 0 || colon == spec.length() - 1) {
            throw new BatchScriptException(
                    line.number(), "invalid wire endpoint '" + spec + "', use 'id:slot'");
        }
        return new String[] {spec.substring(0, colon), spec.substring(colon + 1)};
    }

    private void set(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws WorkflowGraphException {
        List<String> args = line.args();
        if (args.size() < 2) {
            throw new BatchScriptException(line.number(), "set requires a node id and key=value");
        }
        NodeId nodeId = environment.resolve(args.get(0), line.number());
        Options options = Options.parse(line, args.subList(1, args.size()));
        if (options.values.isEmpty()) {
            throw new BatchScriptException(line.number(), "set requires at least one key=value");
        }
        EditResult result = editor.set(state.document, nodeId, options.values);
        state.apply(line, result);
        state.details.add("set: node " + nodeId);
    }

    private void delete(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws WorkflowGraphException {
        boolean cascade = false;
        List<NodeId> ids = new ArrayList<>();
        for (String arg : line.args()) {
            if (arg.equals("--cascade")) {
                cascade = true;
            } else {
                ids.add(environment.resolve(arg, line.number()));
            }
        }
        if (ids.isEmpty()) {
            throw new BatchScriptException(line.number(), "delete requires at least one node id");
        }
        EditResult result = editor.delete(state.document, ids, cascade);
        state.apply(line, result);
        state.details.add("delete: removed nodes " + result.deletedNodes());
    }

    private void disconnect(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws WorkflowGraphException {
        if (line.args().size() != 1) {
            throw new BatchScriptException(line.number(), "disconnect requires one node id");
        }
        NodeId nodeId = environment.resolve(line.args().get(0), line.number());
        EditResult result = editor.disconnect(state.document, nodeId);
        state.apply(line, result);
        state.details.add(
                "disconnect: node " + nodeId + ", " + result.removedLinks().size() + " link(s)");
    }

    private void inline(ScriptLine line, RunState state) throws WorkflowGraphException {
        if (!line.args().isEmpty()) {
            throw new BatchScriptException(line.number(), "inline takes no arguments");
        }
        EditResult result = editor.inline(state.document);
        state.apply(line, result);
        state.details.add(
                "inline: removed "
                        + result.deletedNodes().size()
                        + " node(s), created "
                        + result.createdLinks().size()
                        + " link(s)");
    }

    private void find(ScriptLine line, ScriptEnvironment environment, RunState state)
            throws BatchScriptException {
        List<String> args = line.args();
        if (args.size() != 3 || !args.get(1).equalsIgnoreCase("as") || !args.get(2).startsWith("$")) {
            throw new BatchScriptException(line.number(), "find requires '<pattern> as $name'");
        }
        List<Node> matches = state.document.findNodesByType(args.get(0));
        if (matches.isEmpty()) {
            throw new BatchScriptException(
                    line.number(), "find: no node type matches '" + args.get(0) + "'");
        }
        NodeId found = matches.get(0).getId();
        if (matches.size() > 1) {
            state.warnings.add(
                    "Line "
                            + line.number()
                            + ": find '"
                            + args.get(0)
                            + "' matched "
                            + matches.size()
                            + " nodes, using "
                            + found);
        }
        state.details.add("find: " + args.get(0) + " -> " + bind(environment, args.get(2), found));
    }

    private static String bind(ScriptEnvironment environment, String name, NodeId nodeId) {
        if (name == null) {
            return nodeId.toString();
        }
        environment.bind(name, nodeId);
        return name + " (ID " + nodeId + ")";
    }

    /// Mutable progress of one run.
    private static final class RunState {
        private WorkflowDocument document;
        private final List<EditResult> edits = new ArrayList<>();
        private final List<String> details = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();

        private RunState(WorkflowDocument document) {
            this.document = document;
        }

        private void apply(ScriptLine line, EditResult result) {
            document = result.document();
            edits.add(result);
            result.warnings().forEach(w -> warnings.add("Line " + line.number() + ": " + w));
        }
    }

    /// Trailing options shared by `copy`, `create` and `set`.
    private static final class Options {
        private String name;
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final List<SlotDeclaration> inputs = new ArrayList<>();
        private final List<SlotDeclaration> outputs = new ArrayList<>();

        private String title() {
            Object title = values.remove("title");
            return title != null ? title.toString() : null;
        }

        private static Options parse(ScriptLine line, List<String> args)
                throws BatchScriptException {
            Options options = new Options();
            for (int i = 0; i < args.size(); i++) {
                String arg = args.get(i);
                if (arg.equalsIgnoreCase("as")) {
                    options.name = next(line, args, ++i, "as");
                    if (!options.name.startsWith("$")) {
                        throw new BatchScriptException(
                                line.number(), "binding name must start with '$': " + options.name);
                    }
                } else if (arg.equals("-i")) {
                    options.inputs.add(slot(line, next(line, args, ++i, "-i")));
                } else if (arg.equals("-O")) {
                    options.outputs.add(slot(line, next(line, args, ++i, "-O")));
                } else if (arg.indexOf('=') > 0) {
                    int eq = arg.indexOf('=');
                    options.values.put(
                            arg.substring(0, eq), ValueParser.parse(arg.substring(eq + 1)));
                } else {
                    throw new BatchScriptException(
                            line.number(), "unexpected argument '" + arg + "'");
                }
            }
            return options;
        }

        private static String next(ScriptLine line, List<String> args, int index, String option)
                throws BatchScriptException {
            if (index >= args.size()) {
                throw new BatchScriptException(line.number(), "'" + option + "' needs a value");
            }
            return args.get(index);
        }

        private static SlotDeclaration slot(ScriptLine line, String spec)
                throws BatchScriptException {
            if (spec.indexOf(':') <= 0) {
                throw new BatchScriptException(
                        line.number(), "slot declaration must be name:TYPE, got '" + spec + "'");
            }
            return SlotDeclaration.parse(spec);
        }
    }
}
