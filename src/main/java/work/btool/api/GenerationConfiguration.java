package work.btool.api;

import java.nio.file.Path;
import java.util.Objects;
import work.btool.export.PlanExporter;

/**
 * Immutable configuration of one generation pass.
 *
 * @param runscript  runscript to resolve
 * @param mode       write the script tree or only resolve the plan
 * @param exclude    skip runs that already hold a completion marker
 * @param planFormat format of the exported plan in {@link Mode#PLAN}
 * @param logLevel   log threshold applied before the pass starts
 */
public record GenerationConfiguration(
    Path runscript,
    Mode mode,
    boolean exclude,
    PlanExporter.Format planFormat,
    LogLevel logLevel
) {
    public GenerationConfiguration {
        Objects.requireNonNull(runscript, "runscript");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(planFormat, "planFormat");
        Objects.requireNonNull(logLevel, "logLevel");
    }

    public static Builder builder() {
        return new Builder();
    }

    public enum Mode {
        GENERATE,
        PLAN
    }

    public static final class Builder {
        private Path runscript;
        private Mode mode = Mode.GENERATE;
        private boolean exclude;
        private PlanExporter.Format planFormat = PlanExporter.Format.JSON;
        private LogLevel logLevel = LogLevel.DEFAULT;

        public Builder runscript(Path runscript) {
            this.runscript = runscript;
            return this;
        }

        public Builder mode(Mode mode) {
            this.mode = mode;
            return this;
        }

        public Builder exclude(boolean exclude) {
            this.exclude = exclude;
            return this;
        }

        public Builder planFormat(PlanExporter.Format planFormat) {
            this.planFormat = planFormat;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public GenerationConfiguration build() {
            return new GenerationConfiguration(runscript, mode, exclude, planFormat, logLevel);
        }
    }
}
