package com.rpyflow.compiler;

import com.rpyflow.AppLogger;
import com.rpyflow.LogAggregator;
import com.rpyflow.directives.DirectiveParser;
import com.rpyflow.directives.DirectiveSchema;
import com.rpyflow.models.FlowGraph;
import com.rpyflow.output.GeneratedTree;
import com.rpyflow.render.AssetIndex;
import com.rpyflow.render.TextRenderer;
import com.rpyflow.settings.CompilerSettings;

import java.util.Map;

/**
 * Compiles a flow graph into the in-memory tree of generated files. Nothing is written here;
 * a compilation error leaves the target directory untouched.
 */
public class FlowCompiler {

    private final CompilerSettings settings;
    private final AssetIndex assets;

    public FlowCompiler(CompilerSettings settings, AssetIndex assets) {
        this.settings = settings;
        this.assets = assets != null ? assets : AssetIndex.disabled();
    }

    /**
     * @throws CompilationException on structural errors in the flow
     */
    public CompilationResult compile(FlowGraph graph) {
        LogAggregator log = new LogAggregator();
        Map<String, String> characterTokens =
            SupportFiles.assignCharacterTokens(graph.getEntities(), settings.getCharacterPrefix());
        CompilationContext context = new CompilationContext(settings, graph,
            new DirectiveParser(DirectiveSchema.standard(settings)),
            new TextRenderer(assets, settings.getBeginningsLogLines()),
            log, characterTokens);

        FlowTraverser traverser = new FlowTraverser(context);
        traverser.traverse();

        GeneratedTree tree = new GeneratedTree();
        traverser.render().forEach(tree::addFile);
        traverser.getTopLevelDirectories().forEach(tree::addTopLevelDirectory);
        tree.addFile(settings.prefixed(settings.getVariablesFileName()),
            SupportFiles.renderVariables(graph.getVariables()));
        tree.addFile(settings.prefixed(settings.getCharactersFileName()),
            SupportFiles.renderCharacters(graph.getEntities(), characterTokens));
        // rendered last so it holds every diagnostic, jump fallbacks included
        tree.addFile(settings.prefixed(settings.getLogFileName()), log.render());

        int compiled = context.getLabels().size();
        log("Compiled " + compiled + " node(s) into " + tree.size() + " file(s), "
            + log.size() + " diagnostic(s)");
        return new CompilationResult(tree, log, compiled);
    }

    private void log(String message) {
        if (AppLogger.get() != null) {
            AppLogger.get().info(message);
        }
    }
}
