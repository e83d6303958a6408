package io.nodewright.cli.producers;

import io.nodewright.cli.files.WorkflowFiles;
import io.nodewright.core.GraphEngineConfig;
import io.nodewright.core.NodewrightEngine;
import io.nodewright.core.NodewrightFactory;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// CDI producer for the graph engine and the output file writer.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `nodewright.copy.offset-x` | double | `50` | Horizontal offset of copied nodes |
/// | `nodewright.copy.offset-y` | double | `50` | Vertical offset of copied nodes |
/// | `nodewright.changelog` | boolean | `true` | Append to `<stem>.changelog` on every write |
///
/// @implNote Both products are `@Singleton`: they are final classes and need no
/// client proxy. The engine holds no per-document state.
@ApplicationScoped
public class NodewrightEngineProducer {

    private static final Logger logger =
            Logger.getLogger(NodewrightEngineProducer.class.getName());

    @ConfigProperty(name = "nodewright.copy.offset-x", defaultValue = "50")
    double copyOffsetX;

    @ConfigProperty(name = "nodewright.copy.offset-y", defaultValue = "50")
    double copyOffsetY;

    @ConfigProperty(name = "nodewright.changelog", defaultValue = "true")
    boolean changelog;

    /// Produces the graph engine with the default schemas and pattern rules.
    ///
    /// @return configured engine, never null
    @Produces
    @Singleton
    public NodewrightEngine nodewrightEngine() {
        GraphEngineConfig config =
                GraphEngineConfig.builder().copyOffset(copyOffsetX, copyOffsetY).build();
        logger.fine("Configured engine with copy offset " + copyOffsetX + "," + copyOffsetY);
        return NodewrightFactory.createEngine(config);
    }

    /// Produces the versioning file writer.
    ///
    /// @return file writer using the system clock, never null
    @Produces
    @Singleton
    public WorkflowFiles workflowFiles() {
        return new WorkflowFiles(changelog, Clock.systemDefaultZone());
    }
}
