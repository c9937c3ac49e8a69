package com.boxoffice;

import com.boxoffice.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Abstract base for domain-specific enrichment jobs.
 *
 * <p>Subclasses provide the default config resource, a display name, and the job body.
 * This class loads the YAML configuration, overlays the environment, validates it, and
 * hands it over.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class MoviesJob extends BoxOfficeJobBase {
 *       protected String getDefaultConfigResource() { return "pipeline-config.yaml"; }
 *       protected String getJobName() { return "Movies enrichment"; }
 *       protected int execute(PipelineConfig c) throws Exception { ... }
 *   }
 * </pre>
 */
@Slf4j
public abstract class BoxOfficeJobBase {

    /**
     * Classpath resource loaded when no command-line config path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    protected abstract String getJobName();

    /**
     * Runs the job body with a validated configuration.
     *
     * @return process exit code
     */
    protected abstract int execute(PipelineConfig config) throws Exception;

    /**
     * Loads configuration and runs the job end-to-end. Fatal failures propagate.
     *
     * @param args optional single argument: path to a YAML config file
     */
    public int run(String[] args) throws Exception {
        return run(args, System.getenv());
    }

    public int run(String[] args, Map<String, String> environment) throws Exception {
        PipelineConfig config = loadConfig(args);
        config.applyEnvironment(environment);
        config.validate();

        log.info("=".repeat(60));
        log.info("STARTING {}", getJobName());
        log.info("=".repeat(60));

        int exitCode = execute(config);

        log.info("=".repeat(60));
        log.info("{} COMPLETE", getJobName());
        log.info("=".repeat(60));
        return exitCode;
    }

    protected PipelineConfig loadConfig(String[] args) throws Exception {
        if (args.length > 0) {
            log.info("Loading configuration from file: {}", args[0]);
            return PipelineConfig.load(args[0]);
        }
        String resource = getDefaultConfigResource();
        log.info("Loading configuration from classpath: {}", resource);
        return PipelineConfig.loadFromClasspath(resource);
    }
}
