package io.launchmanager.command;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.jar.Attributes;
import java.util.jar.JarFile;
import java.util.jar.Manifest;

/**
 * Fills a {@link CommandRegistry} from compiled-in {@link CommandPlugin} services and from plugin
 * jars dropped into the commands directory.
 *
 * <p>Every plugin is loaded inside its own failure boundary: a broken one is logged and skipped,
 * startup carries on. Jar plugins get a private class loader that stays open until
 * {@link #close()}.
 */
public final class PluginLoader implements Closeable {
    private static final Logger logger = LogManager.getLogger(PluginLoader.class);

    public static final String COMMAND_CLASS_ATTRIBUTE = "Launch-Manager-Command";
    private static final String JAR_SUFFIX = ".jar";

    private final CommandRegistry registry;
    private final ClassLoader parent;
    private final List<URLClassLoader> loaders = new ArrayList<>();

    public PluginLoader(CommandRegistry registry) {
        this(registry, PluginLoader.class.getClassLoader());
    }

    public PluginLoader(CommandRegistry registry, ClassLoader parent) {
        this.registry = registry;
        this.parent = parent;
    }

    public List<String> loadAll(Path commandsDir) {
        List<String> loaded = new ArrayList<>(loadServices());
        loaded.addAll(loadDirectory(commandsDir));
        return loaded;
    }

    public List<String> loadServices() {
        List<String> loaded = new ArrayList<>();
        Iterator<CommandPlugin> providers = ServiceLoader.load(CommandPlugin.class, parent).iterator();
        while (true) {
            CommandPlugin plugin;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                plugin = providers.next();
            } catch (ServiceConfigurationError e) {
                logger.error("Skipping command plugin that failed to load", e);
                continue;
            }
            try {
                for (CommandEntry entry : plugin.commands()) {
                    if (registerQuietly(entry, plugin.getClass().getName())) {
                        loaded.add(entry.name());
                    }
                }
            } catch (RuntimeException e) {
                logger.error("Skipping command plugin {}", plugin.getClass().getName(), e);
            }
        }
        return loaded;
    }

    public List<String> loadDirectory(Path commandsDir) {
        List<String> loaded = new ArrayList<>();
        if (commandsDir == null || !Files.isDirectory(commandsDir)) {
            logger.debug("No plugin directory at {}", commandsDir);
            return loaded;
        }
        List<Path> jars = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(commandsDir, "*" + JAR_SUFFIX)) {
            for (Path jar : stream) {
                if (!jar.getFileName().toString().startsWith("_")) {
                    jars.add(jar);
                }
            }
        } catch (IOException e) {
            logger.error("Failed to scan plugin directory {}", commandsDir, e);
            return loaded;
        }
        jars.sort(null);
        for (Path jar : jars) {
            try {
                CommandEntry entry = loadJar(jar);
                if (registerQuietly(entry, jar.toString())) {
                    loaded.add(entry.name());
                    logger.info("Loaded command: {}", entry.name());
                }
            } catch (PluginLoadException e) {
                logger.error("Error loading command {}: {}", jar, e.getMessage(), e.getCause());
            }
        }
        return loaded;
    }

    /**
     * {@code bash_status.jar} becomes {@code bash-status}.
     */
    public static String commandNameFor(Path jar) {
        String fileName = jar.getFileName().toString();
        String stem = fileName.toLowerCase(Locale.ROOT).endsWith(JAR_SUFFIX)
                ? fileName.substring(0, fileName.length() - JAR_SUFFIX.length())
                : fileName;
        return stem.replace('_', '-');
    }

    CommandEntry loadJar(Path jar) {
        String className = commandClassName(jar);
        URLClassLoader loader;
        try {
            loader = new URLClassLoader(new URL[] {jar.toUri().toURL()}, parent);
        } catch (IOException e) {
            throw new PluginLoadException(jar, "Cannot open plugin jar", e);
        }
        try {
            Class<?> type = Class.forName(className, true, loader);
            if (!Command.class.isAssignableFrom(type)) {
                throw new PluginLoadException(jar, className + " does not implement " + Command.class.getName());
            }
            Command command = (Command) type.getDeclaredConstructor().newInstance();
            CommandEntry entry = CommandEntry.of(commandNameFor(jar), command);
            loaders.add(loader);
            return entry;
        } catch (PluginLoadException e) {
            closeQuietly(loader);
            throw e;
        } catch (ReflectiveOperationException | LinkageError | RuntimeException e) {
            closeQuietly(loader);
            throw new PluginLoadException(jar, "Cannot instantiate " + className, e);
        }
    }

    private static String commandClassName(Path jar) {
        try (JarFile file = new JarFile(jar.toFile())) {
            Manifest manifest = file.getManifest();
            String className = manifest == null
                    ? null
                    : manifest.getMainAttributes().getValue(new Attributes.Name(COMMAND_CLASS_ATTRIBUTE));
            if (className == null || className.isBlank()) {
                throw new PluginLoadException(jar, "Manifest has no " + COMMAND_CLASS_ATTRIBUTE + " attribute");
            }
            return className.trim();
        } catch (IOException e) {
            throw new PluginLoadException(jar, "Not a readable jar", e);
        }
    }

    private boolean registerQuietly(CommandEntry entry, String source) {
        try {
            registry.register(entry);
            return true;
        } catch (CommandConflictException e) {
            logger.error("Skipping command {} from {}: {}", entry.name(), source, e.getMessage());
            return false;
        }
    }

    private static void closeQuietly(URLClassLoader loader) {
        try {
            loader.close();
        } catch (IOException e) {
            logger.debug("Failed to close plugin class loader", e);
        }
    }

    @Override
    public void close() {
        for (URLClassLoader loader : loaders) {
            closeQuietly(loader);
        }
        loaders.clear();
    }
}
