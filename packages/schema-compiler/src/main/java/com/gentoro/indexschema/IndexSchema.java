package com.gentoro.indexschema;

import com.gentoro.indexschema.cache.FileMetadataCache;
import com.gentoro.indexschema.cache.InMemoryMetadataCache;
import com.gentoro.indexschema.cache.MetadataCache;
import com.gentoro.indexschema.exception.ConfigException;
import com.gentoro.indexschema.exception.IoException;
import com.gentoro.indexschema.exception.StateException;
import com.gentoro.indexschema.logging.LoggingService;
import com.gentoro.indexschema.mapping.SchemaCompiler;
import com.gentoro.indexschema.registry.IndexRegistry;
import com.gentoro.indexschema.utility.JacksonUtility;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads the configuration, wires the cache, compiler and registry, and runs
 * the command selected by the startup parameters.
 */
public class IndexSchema {

  private static final org.slf4j.Logger log = LoggingService.getLogger(IndexSchema.class);

  static final String USAGE =
      """
      Usage: indexschema [--mode compile|registry|help] [--config-file <location>]
                         [--document <class>] [--output <file>]

        compile   print the index definition of each document, keyed by index alias
        registry  register the documents and print the alias to class map
        help      print this message
      """;

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private MetadataCache cache;
  private SchemaCompiler compiler;
  private IndexRegistry registry;

  public IndexSchema(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());

    this.cache = createCache(configuration());
    this.compiler = SchemaCompiler.create(cache, configurationProvider.section("analysis"));
    this.registry = new IndexRegistry(compiler, cache);
    log.debug("IndexSchema initialized with configuration {}", startupParameters.configFile());
  }

  /** Runs the selected mode, writing to {@code --output} when given and to {@code out} otherwise. */
  public void run(PrintStream out) {
    if (compiler == null) {
      throw new StateException("IndexSchema must be initialized before it runs");
    }
    String result =
        switch (startupParameters.mode()) {
          case "compile" -> JacksonUtility.toJson(compileAll());
          case "registry" -> JacksonUtility.toJson(registry.register(documents()));
          default -> USAGE;
        };

    String output = startupParameters.getOptionalParameter("output", String.class).orElse(null);
    if (output == null) {
      out.println(result);
      return;
    }
    Path target = Paths.get(output);
    try {
      Path parent = target.toAbsolutePath().getParent();
      if (parent != null) Files.createDirectories(parent);
      Files.writeString(target, result);
      log.info("Wrote {} output to {}", startupParameters.mode(), target.toAbsolutePath());
    } catch (IOException e) {
      throw new IoException("Failed to write output: " + target, e);
    }
  }

  /** Index definitions of the selected documents keyed by index alias. */
  public Map<String, Object> compileAll() {
    Map<String, Object> definitions = new LinkedHashMap<>();
    for (Class<?> document : documents()) {
      Map<String, Object> definition = compiler.compile(document);
      if (definition.isEmpty()) {
        log.warn("{} did not produce an index definition, is it annotated with @Index?", document);
        continue;
      }
      definitions.put(compiler.indexAlias(document), definition);
    }
    return definitions;
  }

  /** The {@code --document} class when given, the configured {@code documents} otherwise. */
  public List<Class<?>> documents() {
    List<String> names =
        startupParameters
            .getOptionalParameter("document", String.class)
            .map(List::of)
            .orElseGet(() -> configuration().getList(String.class, "documents", List.of()));

    List<Class<?>> documents = new ArrayList<>();
    for (String name : names) {
      try {
        documents.add(
            Class.forName(name.trim(), false, Thread.currentThread().getContextClassLoader()));
      } catch (ClassNotFoundException e) {
        throw new ConfigException("Document class not found: " + name, e);
      }
    }
    return documents;
  }

  private static MetadataCache createCache(Configuration config) {
    String location = config.getString("cache.location", null);
    if (location == null || location.isBlank()) {
      log.debug("No cache.location configured, field name tables are kept in memory");
      return new InMemoryMetadataCache();
    }
    return new FileMetadataCache(Paths.get(location));
  }

  public Configuration configuration() {
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public MetadataCache cache() {
    return cache;
  }

  public SchemaCompiler compiler() {
    return compiler;
  }

  public IndexRegistry registry() {
    return registry;
  }
}
