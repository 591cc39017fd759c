package io.intellixity.tessera.util;

import io.intellixity.tessera.TesseraException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Discovers SQL dialects and other plug-ins listed in {@code META-INF/tessera.factories}.
 * <p>
 * Each resource is a properties file keyed by the SPI's fully qualified name; values are comma-separated
 * implementation class names with a public no-arg constructor:
 * <pre>
 * io.intellixity.tessera.engine.sql.SqlDialect=io.intellixity.tessera.clickhouse.ClickhouseDialect
 * </pre>
 * Order follows classpath order; repeated class names are instantiated once.
 */
public final class TesseraFactoriesLoader {
  private static final Logger log = LoggerFactory.getLogger(TesseraFactoriesLoader.class);

  public static final String RESOURCE = "META-INF/tessera.factories";

  private TesseraFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = cl != null ? cl : TesseraFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(loader)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(newInstance(implName, spiType, loader));
    log.debug("tessera.factories spi={} impls={}", spiType.getSimpleName(), implNames);
    return out;
  }

  private static List<URL> resources(ClassLoader loader) {
    try {
      List<URL> urls = new ArrayList<>();
      Enumeration<URL> e = loader.getResources(RESOURCE);
      while (e.hasMoreElements()) urls.add(e.nextElement());
      return urls;
    } catch (IOException e) {
      throw new TesseraException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
      return p;
    } catch (IOException e) {
      throw new TesseraException("Failed to load " + RESOURCE + " from " + url, e);
    }
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new TesseraException("Class " + implName + " listed for " + spiType.getName() + " is not on the classpath", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new TesseraException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new TesseraException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
