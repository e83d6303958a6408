package io.nodewright.cli.commands;

import io.nodewright.core.exception.WorkflowGraphException;
import io.nodewright.core.graph.Node;
import io.nodewright.core.graph.NodeId;
import io.nodewright.core.graph.WidgetValues;
import io.nodewright.core.graph.WorkflowDocument;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Prints a node's widget values with their storage layout.
@Command(name = "values", description = "Show widget values of a node")
class WorkflowValuesCommand extends ReportCommand {

    private static final int MAX_VALUE_LENGTH = 80;

    @Parameters(index = "1", paramLabel = "NODE", description = "Node id")
    private String nodeId;

    @Override
    protected int execute() throws WorkflowGraphException, IOException {
        WorkflowDocument document = loadWorkflow();
        Node node = document.node(NodeId.parse(nodeId));
        WidgetValues widgets = engine.getAnalyzer().values(document, node.getId());

        print(
                widgets,
                () -> {
                    System.out.println(styles().bold(node.displayName()));
                    if (widgets.isEmpty()) {
                        System.out.println();
                        System.out.println("No widget values");
                        return;
                    }
                    System.out.println();
                    String layout = widgets.layout().name().toLowerCase(Locale.ROOT);
                    System.out.println("Widget values (" + layout + "):");
                    if (widgets.layout() == WidgetValues.Layout.POSITIONAL) {
                        List<Object> values = widgets.asList();
                        for (int i = 0; i < values.size(); i++) {
                            System.out.println("  [" + i + "] " + shorten(values.get(i)));
                        }
                    } else {
                        widgets.asMap()
                                .forEach(
                                        (key, value) ->
                                                System.out.println("  " + key + ": " + shorten(value)));
                    }
                });
        return ExitCode.OK;
    }

    private static String shorten(Object value) {
        String text = value instanceof String s ? "\"" + s + "\"" : String.valueOf(value);
        if (text.length() > MAX_VALUE_LENGTH) {
            return text.substring(0, MAX_VALUE_LENGTH) + "...";
        }
        return text;
    }
}
