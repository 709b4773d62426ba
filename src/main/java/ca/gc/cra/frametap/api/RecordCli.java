package ca.gc.cra.frametap.api;

/**
 * Subscribes to frames and persists images and annotations. At least one of {@code imageDir} or
 * {@code logDir} is required; display is off unless requested.
 *
 * @since 0.1.0
 */
public final class RecordCli {
  static final String MODE = "record";
  private static final String SUMMARY_USAGE =
      "usage: record imageDir=PATH|logDir=PATH [connect=URL,...|bind=URL,...] [topics=PREFIX,...] "
          + "[inhibit=S] [logInterval=S] [flatten=true] [csvFields=a,b] [imageEncoding=JPEG|PNG] "
          + "[jpegQuality=1-100] [fileIdKey=PATH] [timezone=ZONE] [config=FILE] [--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      FrameTap recorder

      Usage:
        record imageDir=PATH|logDir=PATH [options]

      Outputs (at least one):
        imageDir=PATH             Directory for images, named <timestamp>_<id>.<ext>
        logDir=PATH               Directory for annotation windows (.jsonl or .csv)

      Persistence:
        inhibit=SECONDS           Minimum spacing between persisted frames (default 0)
        logInterval=SECONDS       Annotation window length, >= 1 (default 60)
        flatten=true|false        Flatten nested annotations to dotted keys
        csvFields=a,b,...         Write CSV with these columns instead of JSON lines
        imageEncoding=JPEG|PNG    Image file format (default JPEG)
        jpegQuality=1-100         JPEG quality (default 95)
        fileIdKey=PATH            Annotation dot path naming image files (default source_id)
        timezone=ZONE             Zone for file-name timestamps (default system)

      Transport and display options are shared with view (see view --help).
      display defaults to false for record.

        config=FILE               YAML file with common: and record: sections
        --dry-run                 Validate and print the plan
        --allow-overwrite         Permit non-empty output directories
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private RecordCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return SubscriberCli.run(MODE, args, SUMMARY_USAGE, HELP_TEXT);
  }
}
