/**
 * Configuration records, YAML/CLI merging and adapter wiring.
 *
 * <p>Settings flow from {@link ca.gc.cra.frametap.config.DefaultsForMode} through
 * {@link ca.gc.cra.frametap.config.YamlConfigLoader} and CLI overrides, are merged by
 * {@link ca.gc.cra.frametap.config.ConfigMerger}, validated into
 * {@link ca.gc.cra.frametap.config.SubscriberConfig} or {@link ca.gc.cra.frametap.config.PublisherConfig},
 * and finally wired by {@link ca.gc.cra.frametap.config.CompositionRoot}.</p>
 */
package ca.gc.cra.frametap.config;
