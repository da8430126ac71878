/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fjc.frontend.imports;

import java.io.File;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import exm.fjc.common.Logging;
import exm.fjc.common.Settings;
import exm.fjc.common.exceptions.InvalidOptionException;

/**
 * Resolve module specifiers from import directives.  Strategies are tried
 * in a fixed order: framework package table, local files under the project
 * root, then the package cache directory.
 *
 * Results are memoized per (specifier, items) pair, with resolved and
 * unresolved outcomes in separate tables.  A resolver instance may be
 * shared between threads compiling different units.
 */
public class ImportResolver {
  private static final Logger logger = Logging.getFJCLogger();

  public static final List<String> EXTENSIONS = ImmutableList.of(".js", ".fjs");

  public static final String INDEX = "index";

  private static final String FRAMEWORK_SCOPE = "@flutterjs/";

  public static final Map<String, String> FRAMEWORK_PACKAGES =
      ImmutableMap.<String, String>builder()
        .put("@flutterjs/runtime", "@flutterjs/runtime")
        .put("@flutterjs/vdom", "@flutterjs/vdom")
        .put("@flutterjs/analyzer", "@flutterjs/analyzer")
        .put("@flutterjs/material", "@flutterjs/material")
        .put("@flutterjs/cupertino", "@flutterjs/cupertino")
        .put("@flutterjs/foundation", "@flutterjs/foundation")
        .put("package:flutter/material.dart", "@flutterjs/material")
        .put("package:flutter/widgets.dart", "@flutterjs/runtime")
        .put("package:flutter/cupertino.dart", "@flutterjs/cupertino")
        .put("package:flutter/foundation.dart", "@flutterjs/foundation")
        .build();

  private final String projectRoot;
  private final List<String> searchRoots;
  /** Null if no package cache */
  private final String packageCacheDir;
  private final boolean cacheEnabled;
  private final FileProber prober;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, String> customMappings =
                              new HashMap<String, String>();
  private final Map<Pair<String, List<String>>, ResolutionResult> resolved =
      new HashMap<Pair<String, List<String>>, ResolutionResult>();
  private final Map<Pair<String, List<String>>, ResolutionResult> unresolved =
      new HashMap<Pair<String, List<String>>, ResolutionResult>();

  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong cacheMisses = new AtomicLong();
  private final AtomicLong probes = new AtomicLong();

  private ImportResolver(Builder b) {
    // Relative specifiers may climb above a relative root such as "."
    this.projectRoot = FilenameUtils.normalize(
                          new File(b.projectRoot).getAbsolutePath());
    this.searchRoots = ImmutableList.copyOf(b.searchRoots);
    this.packageCacheDir = StringUtils.isEmpty(b.packageCacheDir) ?
                           null : b.packageCacheDir;
    this.cacheEnabled = b.cacheEnabled;
    this.prober = b.prober;
    this.customMappings.putAll(b.customMappings);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Resolver configured from the fjc.* settings
   */
  public static ImportResolver fromSettings() throws InvalidOptionException {
    return builder()
        .projectRoot(Settings.get(Settings.PROJECT_ROOT))
        .searchRoots(Settings.getSearchRoots())
        .packageCacheDir(Settings.get(Settings.PACKAGE_CACHE_DIR))
        .cacheEnabled(Settings.getBoolean(Settings.IMPORT_CACHE))
        .build();
  }

  /**
   * Resolve a module.  Never throws for bad input: failures are reported
   * in the result.
   * @param specifier module specifier as written
   * @param items names imported from the module
   */
  public ResolutionResult resolve(String specifier, List<String> items) {
    Pair<String, List<String>> key =
        Pair.<String, List<String>>of(specifier,
                                          ImmutableList.copyOf(items));
    if (cacheEnabled) {
      ResolutionResult cached = lookupCache(key);
      if (cached != null) {
        cacheHits.incrementAndGet();
        logger.trace("Import " + specifier + " served from cache");
        return cached;
      }
    }
    cacheMisses.incrementAndGet();

    ResolutionResult result = resolveUncached(specifier, key.getRight());
    logger.debug("Resolved import " + result);
    if (!cacheEnabled) {
      return result;
    }

    lock.writeLock().lock();
    try {
      Map<Pair<String, List<String>>, ResolutionResult> table =
                        result.isValid() ? resolved : unresolved;
      // Another thread may have got there first: keep its result
      ResolutionResult prev = table.get(key);
      if (prev != null) {
        return prev;
      }
      table.put(key, result);
      return result;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private ResolutionResult lookupCache(Pair<String, List<String>> key) {
    lock.readLock().lock();
    try {
      ResolutionResult r = resolved.get(key);
      if (r == null) {
        r = unresolved.get(key);
      }
      return r;
    } finally {
      lock.readLock().unlock();
    }
  }

  private ResolutionResult resolveUncached(String specifier,
                                           List<String> items) {
    List<FallbackStep> fallbacks = new ArrayList<FallbackStep>();

    // Step 1: framework packages and custom mappings
    if (isFrameworkPackage(specifier)) {
      String target = lookupMapping(specifier);
      if (target != null) {
        return new ResolutionResult(specifier, items,
            ResolutionType.FRAMEWORK, target, null,
            "Resolved from framework mappings", fallbacks);
      }
      fallbacks.add(new FallbackStep(1, FallbackStep.FRAMEWORK_PACKAGE,
          false, "Framework package \"" + specifier +
          "\" not found in mappings"));
    }

    // Step 2: local files.  Scoped packages are never local.
    if (!specifier.startsWith("@")) {
      List<String> searched = new ArrayList<String>();
      String path = resolveLocal(specifier, searched);
      if (path != null) {
        return new ResolutionResult(specifier, items, ResolutionType.LOCAL,
            specifier, path, "Found in local project at " + path, fallbacks);
      }
      String reason;
      if (isRelative(specifier)) {
        reason = "Relative import not found: " + specifier;
      } else {
        reason = "Local import not found in: " +
                 StringUtils.join(searchRoots, ", ");
      }
      fallbacks.add(new FallbackStep(2, FallbackStep.LOCAL_CODE, false,
                                     reason));
    }

    // Step 3: package cache
    if (packageCacheDir != null) {
      String path = FilenameUtils.concat(packageCacheDir,
                                         specifier + "/" + INDEX + ".js");
      if (path != null && probe(path)) {
        path = FilenameUtils.separatorsToUnix(path);
        return new ResolutionResult(specifier, items, ResolutionType.CACHE,
            specifier, path, "Found in package cache at " + path, fallbacks);
      }
      fallbacks.add(new FallbackStep(3, FallbackStep.PACKAGE_CACHE, false,
          "Not found in package cache " + packageCacheDir));
    } else {
      fallbacks.add(new FallbackStep(3, FallbackStep.PACKAGE_CACHE, false,
          "No package cache configured"));
    }

    return new ResolutionResult(specifier, items, ResolutionType.ERROR,
        null, null, errorMessage(specifier, fallbacks), fallbacks);
  }

  private static boolean isFrameworkPackage(String specifier) {
    return specifier.startsWith(FRAMEWORK_SCOPE) ||
           specifier.startsWith("@package:") ||
           FRAMEWORK_PACKAGES.containsKey(specifier);
  }

  private static boolean isRelative(String specifier) {
    return specifier.startsWith("./") || specifier.startsWith("../");
  }

  private String lookupMapping(String specifier) {
    String target = FRAMEWORK_PACKAGES.get(specifier);
    if (target != null) {
      return target;
    }
    lock.readLock().lock();
    try {
      return customMappings.get(specifier);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * @param searched paths tried are appended
   * @return path of file found, or null
   */
  private String resolveLocal(String specifier, List<String> searched) {
    if (isRelative(specifier)) {
      String full = FilenameUtils.concat(projectRoot, specifier);
      if (full == null) {
        // Climbs above the filesystem root
        return null;
      }
      List<String> candidates = new ArrayList<String>();
      candidates.add(full);
      for (String ext: EXTENSIONS) {
        candidates.add(full + ext);
      }
      return probeAll(candidates, searched);
    }

    for (String root: searchRoots) {
      String full = FilenameUtils.concat(
                        FilenameUtils.concat(projectRoot, root), specifier);
      if (full == null) {
        continue;
      }
      List<String> candidates = new ArrayList<String>();
      for (String ext: EXTENSIONS) {
        candidates.add(FilenameUtils.concat(full, INDEX + ext));
        candidates.add(full + ext);
      }
      String found = probeAll(candidates, searched);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private String probeAll(List<String> candidates, List<String> searched) {
    for (String c: candidates) {
      String path = FilenameUtils.separatorsToUnix(c);
      searched.add(path);
      if (probe(path)) {
        return path;
      }
    }
    return null;
  }

  private boolean probe(String path) {
    probes.incrementAndGet();
    boolean found = prober.isFile(path);
    logger.trace("probe " + path + ": " + found);
    return found;
  }

  private static String errorMessage(String specifier,
                                     List<FallbackStep> fallbacks) {
    StringBuilder sb = new StringBuilder();
    sb.append("Cannot resolve import \"").append(specifier).append("\"");
    for (FallbackStep f: fallbacks) {
      sb.append("; ").append(f.getStrategyTried()).append(": ")
        .append(f.getReason());
    }
    return sb.toString();
  }

  /**
   * Map a module specifier to a framework package.  Unresolved results
   * for the specifier are dropped from the cache.
   */
  public void addCustomMapping(String specifier, String target) {
    lock.writeLock().lock();
    try {
      customMappings.put(specifier, target);
      List<Pair<String, List<String>>> stale =
                        new ArrayList<Pair<String, List<String>>>();
      for (Pair<String, List<String>> key: unresolved.keySet()) {
        if (key.getLeft().equals(specifier)) {
          stale.add(key);
        }
      }
      for (Pair<String, List<String>> key: stale) {
        unresolved.remove(key);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void clearCache() {
    lock.writeLock().lock();
    try {
      resolved.clear();
      unresolved.clear();
    } finally {
      lock.writeLock().unlock();
    }
    cacheHits.set(0);
    cacheMisses.set(0);
    probes.set(0);
  }

  public ResolverStats getStats() {
    int resolvedCount, unresolvedCount;
    lock.readLock().lock();
    try {
      resolvedCount = resolved.size();
      unresolvedCount = unresolved.size();
    } finally {
      lock.readLock().unlock();
    }
    return new ResolverStats(cacheHits.get(), cacheMisses.get(), probes.get(),
                             resolvedCount, unresolvedCount);
  }

  public static class ResolverStats {
    public final long cacheHits;
    public final long cacheMisses;
    public final long probes;
    public final int resolvedEntries;
    public final int unresolvedEntries;

    public ResolverStats(long cacheHits, long cacheMisses, long probes,
                         int resolvedEntries, int unresolvedEntries) {
      this.cacheHits = cacheHits;
      this.cacheMisses = cacheMisses;
      this.probes = probes;
      this.resolvedEntries = resolvedEntries;
      this.unresolvedEntries = unresolvedEntries;
    }

    @Override
    public String toString() {
      return "hits=" + cacheHits + " misses=" + cacheMisses + " probes=" +
             probes + " resolved=" + resolvedEntries + " unresolved=" +
             unresolvedEntries;
    }
  }

  public static class Builder {
    private String projectRoot = ".";
    private List<String> searchRoots =
        ImmutableList.of("src", "lib", "packages", "modules", ".");
    private String packageCacheDir = null;
    private boolean cacheEnabled = true;
    private FileProber prober = DiskFileProber.INSTANCE;
    private final Map<String, String> customMappings =
                                  new HashMap<String, String>();

    public Builder projectRoot(String projectRoot) {
      this.projectRoot = projectRoot;
      return this;
    }

    public Builder searchRoots(List<String> searchRoots) {
      this.searchRoots = searchRoots;
      return this;
    }

    public Builder packageCacheDir(String dir) {
      this.packageCacheDir = dir;
      return this;
    }

    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    public Builder prober(FileProber prober) {
      this.prober = prober;
      return this;
    }

    public Builder mapping(String specifier, String target) {
      customMappings.put(specifier, target);
      return this;
    }

    public ImportResolver build() {
      return new ImportResolver(this);
    }
  }
}
