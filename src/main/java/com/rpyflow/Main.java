package com.rpyflow;

import com.rpyflow.compiler.CompilationException;
import com.rpyflow.compiler.CompilationResult;
import com.rpyflow.compiler.FlowCompiler;
import com.rpyflow.models.FlowGraph;
import com.rpyflow.output.GenerationDiff;
import com.rpyflow.output.OutputReconciler;
import com.rpyflow.output.UnexpectedContentException;
import com.rpyflow.render.AssetIndex;
import com.rpyflow.settings.CompilerSettings;
import com.rpyflow.settings.SettingsFile;
import com.rpyflow.storage.ExportLoader;

import java.io.IOException;
import java.io.UncheckedIOException;

public class Main {

    private static final String VERSION = "1.0.0";
    private static AppLogger logger;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one compilation.
     *
     * @return the process exit code: 0 on success, 1 on any error
     */
    static int run(String[] args) {
        AppConfig config = new AppConfig.Builder()
                .parseArgs(args)
                .build();
        try {
            AppLogger.initialize(config.getLogFile(), !config.isQuiet());
        } catch (IOException e) {
            System.err.println("Failed to open log file " + config.getLogFile() + ": " + e.getMessage());
            return 1;
        }
        logger = AppLogger.get();
        printBanner(config);
        for (String ignored : config.getIgnoredArgs()) {
            logger.warn("Ignoring unknown argument: " + ignored);
        }

        CompilerSettings settings = null;
        try {
            settings = SettingsFile.load(config.getSettingsPath());
            logger.info("Settings loaded from " + config.getSettingsPath());

            FlowGraph graph = new ExportLoader(settings).load(settings.getPathArticyJson());
            AssetIndex assets = AssetIndex.forTargetDir(settings.getPathTargetDir());
            if (!assets.isEnabled()) {
                logger.warn("No Ren'Py \"game\" directory above " + settings.getPathTargetDir()
                    + ", asset references are not checked");
            }

            CompilationResult result = new FlowCompiler(settings, assets).compile(graph);
            OutputReconciler.Report report = new OutputReconciler(settings.getPathTargetDir(), settings.getFilePrefix())
                .reconcile(result.getTree());

            printSummary(settings, result, report, config.isShowDiff());
            return 0;
        } catch (UnexpectedContentException e) {
            logger.error("Refusing to clear target directory: " + e.getMessage());
        } catch (CompilationException e) {
            logger.error("Compilation failed: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.error((settings == null ? "Configuration error: " : "Compilation failed: ") + e.getMessage());
        } catch (IOException e) {
            logger.error("I/O error: " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            logger.error("I/O error: " + e.getMessage(), e.getCause());
        }
        return 1;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  rpyflow v" + VERSION);
        logger.console("========================================");
        logger.console("  Settings: " + config.getSettingsPath());
    }

    private static void printSummary(CompilerSettings settings, CompilationResult result,
                                     OutputReconciler.Report report, boolean showDiff) {
        GenerationDiff diff = report.getDiff();
        logger.console("");
        logger.console("  Nodes compiled: " + result.getCompiledNodes());
        logger.console("  Files written:  " + report.getWrittenFiles());
        logger.console("  Diagnostics:    " + result.getLog().size()
            + " (see " + settings.prefixed(settings.getLogFileName()) + ")");
        if (!diff.hasChanges()) {
            logger.console("  No changes since the previous generation");
        }
        for (String line : diff.summary()) {
            logger.console("  " + line);
        }
        if (showDiff && diff.hasChanges()) {
            logger.console("");
            logger.console(diff.unifiedDiff());
        }
    }
}
