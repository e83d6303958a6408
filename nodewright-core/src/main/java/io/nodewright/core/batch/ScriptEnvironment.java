package io.nodewright.core.batch;

import io.nodewright.core.exception.BatchScriptException;
import io.nodewright.core.graph.NodeId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// `$name` to node id bindings for one script execution.
///
/// A fresh environment is created per run and passed to every line; nothing
/// survives between runs.
public final class ScriptEnvironment {

    private final Map<String, NodeId> bindings = new LinkedHashMap<>();

    /// Binds a name, replacing any earlier binding.
    ///
    /// @param name binding name with or without the leading `$`, not null
    /// @param nodeId bound node, not null
    public void bind(String name, NodeId nodeId) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        bindings.put(stripSigil(name), nodeId);
    }

    /// Resolves a node reference: `$name` is looked up, anything else is
    /// parsed as a literal id.
    ///
    /// @param token reference token, not null
    /// @param lineNumber line being executed, for error reporting
    /// @return the node id, never null
    /// @throws BatchScriptException if `$name` is not bound
    public NodeId resolve(String token, int lineNumber) throws BatchScriptException {
        if (token.startsWith("$")) {
            NodeId bound = bindings.get(stripSigil(token));
            if (bound == null) {
                throw new BatchScriptException(lineNumber, "undefined variable '" + token + "'");
            }
            return bound;
        }
        if (token.isBlank()) {
            throw new BatchScriptException(lineNumber, "missing node id");
        }
        return NodeId.parse(token);
    }

    public boolean isBound(String name) {
        return bindings.containsKey(stripSigil(name));
    }

    /// @return bindings in definition order, read-only
    public Map<String, NodeId> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    private static String stripSigil(String name) {
        return name.startsWith("$") ? name.substring(1) : name;
    }
}
