package com.scholary.videodigest.cli;

import com.scholary.videodigest.catalog.SourceType;
import com.scholary.videodigest.config.GeminiProperties;
import com.scholary.videodigest.generation.GenerationBackend;
import com.scholary.videodigest.generation.GenerationBackendFactory;
import com.scholary.videodigest.monitor.TrackedSource;
import com.scholary.videodigest.service.MonitorService;
import com.scholary.videodigest.service.MonitorService.CheckReport;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Command line surface of the upload monitor.
 *
 * <p>Commands:
 *
 * <ul>
 *   <li>{@code add <sourceId> [--name=...] [--limit=N] [--type=channel|playlist]}
 *   <li>{@code list}
 *   <li>{@code check [--source=...]... [--limit=N] [--api-key=...]} (the default)
 * </ul>
 *
 * <p>Active only with {@code monitor.cli.enabled=true}, normally through the {@code monitor}
 * profile. A failing command throws, which makes the process exit with a non-zero status.
 */
@Component
@ConditionalOnProperty(prefix = "monitor.cli", name = "enabled", havingValue = "true")
public class MonitorCliRunner implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitorCliRunner.class);

  private final MonitorService monitorService;
  private final GenerationBackendFactory backendFactory;
  private final GeminiProperties geminiProperties;
  private final PrintStream out;

  @Autowired
  public MonitorCliRunner(
      MonitorService monitorService,
      GenerationBackendFactory backendFactory,
      GeminiProperties geminiProperties) {
    this(monitorService, backendFactory, geminiProperties, System.out);
  }

  MonitorCliRunner(
      MonitorService monitorService,
      GenerationBackendFactory backendFactory,
      GeminiProperties geminiProperties,
      PrintStream out) {
    this.monitorService = monitorService;
    this.backendFactory = backendFactory;
    this.geminiProperties = geminiProperties;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    String command = positional.isEmpty() ? "check" : positional.get(0);

    if ("add".equals(command)) {
      add(args, positional);
    } else if ("list".equals(command)) {
      list();
    } else if ("check".equals(command)) {
      check(args);
    } else {
      throw new IllegalArgumentException(
          "Unknown command '" + command + "'; expected add, list or check");
    }
  }

  private void add(ApplicationArguments args, List<String> positional) {
    if (positional.size() < 2) {
      throw new IllegalArgumentException("Usage: add <sourceId> [--name=] [--limit=] [--type=]");
    }
    String type = option(args, "type");
    TrackedSource source =
        monitorService.addSource(
            positional.get(1),
            option(args, "name"),
            type != null ? SourceType.fromValue(type) : null,
            intOption(args, "limit"));
    out.printf(
        "Tracking %s (%s)%n",
        source.displayName(), source.getType().name().toLowerCase(Locale.ROOT));
  }

  private void list() {
    List<TrackedSource> sources = monitorService.listSources();
    if (sources.isEmpty()) {
      out.println("No sources tracked");
      return;
    }
    for (TrackedSource source : sources) {
      out.printf(
          "%s\t%s\t%s\tlimit=%s\tknown=%d%n",
          source.getId(),
          source.getType().name().toLowerCase(Locale.ROOT),
          source.displayName(),
          source.getLimit() != null ? source.getLimit() : "default",
          source.getKnownIds().size());
    }
  }

  private void check(ApplicationArguments args) {
    String apiKey = option(args, "api-key");
    if (!StringUtils.hasText(apiKey)) {
      apiKey = geminiProperties.apiKey();
    }
    if (!StringUtils.hasText(apiKey)) {
      throw new IllegalStateException(
          "check needs a Gemini API key: pass --api-key or set API_KEY");
    }

    GenerationBackend backend = backendFactory.create(apiKey);
    List<String> sources =
        args.containsOption("source") ? args.getOptionValues("source") : List.of();
    CheckReport report = monitorService.check(sources, intOption(args, "limit"), backend);

    LOGGER.info(
        "Check finished: sources={}, new={}, processed={}, skipped={}",
        report.sourcesChecked(),
        report.newItems(),
        report.processed(),
        report.skipped());
    out.printf(
        "Checked %d source(s): %d new, %d processed, %d skipped%n",
        report.sourcesChecked(),
        report.newItems(),
        report.processed(),
        report.skipped());
  }

  private static String option(ApplicationArguments args, String name) {
    if (!args.containsOption(name)) {
      return null;
    }
    List<String> values = args.getOptionValues(name);
    return values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private static Integer intOption(ApplicationArguments args, String name) {
    String value = option(args, name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.valueOf(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("--" + name + " must be a number: " + value, e);
    }
  }
}
