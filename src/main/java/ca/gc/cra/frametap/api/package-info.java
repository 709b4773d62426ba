/**
 * Command-line entry points: the {@code frametap} dispatcher and the {@code view}, {@code record}
 * and {@code publish} commands.
 *
 * <p>Every command follows the same sequence: parse flags and {@code key=value} arguments, merge
 * them over YAML and defaults, validate into a config record, then either print a dry-run plan or
 * run the wired loop and map failures to an {@link ca.gc.cra.frametap.api.ExitCode}.</p>
 */
package ca.gc.cra.frametap.api;
