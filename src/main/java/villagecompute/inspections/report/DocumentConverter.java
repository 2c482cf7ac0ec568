package villagecompute.inspections.report;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import villagecompute.inspections.exceptions.JobCancelledException;
import villagecompute.inspections.jobs.JobContext;

/**
 * Converts rendered HTML to PDF or DOCX by running an external converter.
 *
 * <p>
 * <b>Commands:</b>
 * <ul>
 * <li>PDF - {@code <pdf-command> input.html output.pdf} (WeasyPrint)</li>
 * <li>DOCX - {@code <docx-command> input.html -o output.docx} (Pandoc)</li>
 * </ul>
 *
 * <p>
 * The process is bounded by the job deadline and destroyed when the job is cancelled. Files live in a temporary
 * directory removed after every call.
 */
@ApplicationScoped
public class DocumentConverter {

    private static final Logger LOG = Logger.getLogger(DocumentConverter.class);

    private static final Duration POLL = Duration.ofMillis(200);
    private static final Duration DEFAULT_LIMIT = Duration.ofMinutes(2);
    private static final int MAX_ERROR_OUTPUT = 500;

    @ConfigProperty(
            name = "inspections.reports.pdf-command",
            defaultValue = "weasyprint")
    String pdfCommand;

    @ConfigProperty(
            name = "inspections.reports.docx-command",
            defaultValue = "pandoc")
    String docxCommand;

    /**
     * @throws ConversionException
     *             if the converter cannot be started, exits non-zero or produces no output
     * @throws JobCancelledException
     *             if the job is cancelled while the converter runs
     */
    public byte[] convert(String html, ReportFormat format, JobContext context) {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("report-");
            Path input = workDir.resolve("report.html");
            Path output = workDir.resolve("report." + format.getValue());
            Path log = workDir.resolve("converter.log");
            Files.writeString(input, html, StandardCharsets.UTF_8);

            List<String> command = command(format, input, output);
            LOG.debugf("Running converter: %s", command);
            Process process = new ProcessBuilder(command).redirectErrorStream(true).redirectOutput(log.toFile())
                    .start();
            awaitExit(process, context);

            if (process.exitValue() != 0) {
                throw new ConversionException(format.getValue() + " converter exited with " + process.exitValue()
                        + ": " + tail(log));
            }
            if (!Files.exists(output) || Files.size(output) == 0) {
                throw new ConversionException(format.getValue() + " converter produced no output");
            }
            return Files.readAllBytes(output);

        } catch (IOException e) {
            throw new ConversionException("Failed to run " + format.getValue() + " converter: " + e.getMessage(), e);
        } finally {
            deleteQuietly(workDir);
        }
    }

    List<String> command(ReportFormat format, Path input, Path output) {
        List<String> command = new ArrayList<>();
        switch (format) {
            case PDF -> {
                command.add(pdfCommand);
                command.add(input.toString());
                command.add(output.toString());
            }
            case DOCX -> {
                command.add(docxCommand);
                command.add(input.toString());
                command.add("-o");
                command.add(output.toString());
            }
        }
        return command;
    }

    private void awaitExit(Process process, JobContext context) {
        Duration remaining = context.remaining();
        long deadline = System.nanoTime() + (remaining != null ? remaining : DEFAULT_LIMIT).toNanos();
        try {
            while (!process.waitFor(POLL.toMillis(), TimeUnit.MILLISECONDS)) {
                if (context.isCancelled() || System.nanoTime() - deadline >= 0) {
                    process.destroyForcibly();
                    throw new JobCancelledException("Report conversion aborted: "
                            + (context.cancellationReason() != null ? context.cancellationReason() : "time limit"));
                }
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new JobCancelledException("Interrupted during report conversion", e);
        }
    }

    private static String tail(Path log) {
        try {
            String output = Files.readString(log, StandardCharsets.UTF_8).strip();
            return output.length() > MAX_ERROR_OUTPUT ? output.substring(output.length() - MAX_ERROR_OUTPUT) : output;
        } catch (IOException e) {
            return "(no output)";
        }
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> path.toFile().delete());
        } catch (IOException e) {
            LOG.warnf(e, "Failed to delete temporary report directory %s", dir);
        }
    }

    /**
     * Exception thrown when an external converter fails. Transient: the job is retried.
     */
    public static class ConversionException extends RuntimeException {

        public ConversionException(String message) {
            super(message);
        }

        public ConversionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
