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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.commons.io.FilenameUtils;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.fjc.common.Logging;

public class ImportResolverTest {

  private static final List<String> NO_ITEMS = Collections.emptyList();

  /** Answers from a fixed set of paths and counts the questions */
  private static class CountingProber implements FileProber {
    private final Set<String> files;
    final AtomicInteger calls = new AtomicInteger();

    CountingProber(String... files) {
      this.files = new HashSet<String>(Arrays.asList(files));
    }

    @Override
    public boolean isFile(String path) {
      calls.incrementAndGet();
      return files.contains(path);
    }
  }

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ImportResolverTest.fjc.log", true);
  }

  private static ImportResolver.Builder resolver(FileProber prober) {
    return ImportResolver.builder().projectRoot("/proj").prober(prober);
  }

  @Test
  public void testFrameworkPackage() {
    CountingProber prober = new CountingProber();
    ImportResolver r = resolver(prober).build();
    ResolutionResult res = r.resolve("package:flutter/widgets.dart",
                                     Arrays.asList("StatelessWidget"));
    assertTrue(res.isValid());
    assertEquals(ResolutionType.FRAMEWORK, res.getType());
    assertEquals("@flutterjs/runtime", res.getResolved());
    assertNull(res.getActualPath());
    assertEquals("Framework lookup touches no files", 0, prober.calls.get());
  }

  @Test
  public void testRelativeLocalImport() {
    CountingProber prober = new CountingProber("/proj/lib/util.js");
    ResolutionResult res = resolver(prober).build()
                              .resolve("./lib/util", NO_ITEMS);
    assertEquals(ResolutionType.LOCAL, res.getType());
    assertEquals("/proj/lib/util.js", res.getActualPath());
    assertEquals("Exact path tried before extensions", 2,
                 prober.calls.get());
  }

  @Test
  public void testParentImport() {
    CountingProber prober = new CountingProber("/work/shared/util.js");
    ResolutionResult res = ImportResolver.builder().projectRoot("/work/app")
        .prober(prober).build().resolve("../shared/util", NO_ITEMS);
    assertEquals(ResolutionType.LOCAL, res.getType());
    assertEquals("/work/shared/util.js", res.getActualPath());
  }

  @Test
  public void testParentImportFromDefaultRoot() {
    String parent = FilenameUtils.separatorsToUnix(
        new File(".").getAbsoluteFile().getParentFile().getParent());
    String expected = FilenameUtils.concat(parent, "shared/util.js");
    expected = FilenameUtils.separatorsToUnix(expected);
    CountingProber prober = new CountingProber(expected);
    ResolutionResult res = ImportResolver.builder().prober(prober).build()
                              .resolve("../shared/util", NO_ITEMS);
    assertTrue("Relative root is made absolute", prober.calls.get() > 0);
    assertEquals(ResolutionType.LOCAL, res.getType());
    assertEquals(expected, res.getActualPath());
  }

  @Test
  public void testSearchRoots() {
    CountingProber prober = new CountingProber("/proj/lib/widgets/index.js");
    ResolutionResult res = resolver(prober)
        .searchRoots(Arrays.asList("src", "lib")).build()
        .resolve("widgets", NO_ITEMS);
    assertEquals(ResolutionType.LOCAL, res.getType());
    assertEquals("/proj/lib/widgets/index.js", res.getActualPath());
  }

  @Test
  public void testCachedResultEqualsFresh() {
    CountingProber prober = new CountingProber("/proj/lib/util.js");
    ImportResolver cached = resolver(prober).build();
    ResolutionResult first = cached.resolve("./lib/util", NO_ITEMS);
    int probesAfterFirst = prober.calls.get();
    ResolutionResult second = cached.resolve("./lib/util", NO_ITEMS);
    assertSame("Second lookup comes from the cache", first, second);
    assertEquals("Cache hit does not probe again", probesAfterFirst,
                 prober.calls.get());

    CountingProber prober2 = new CountingProber("/proj/lib/util.js");
    ImportResolver uncached = resolver(prober2).cacheEnabled(false).build();
    ResolutionResult fresh1 = uncached.resolve("./lib/util", NO_ITEMS);
    ResolutionResult fresh2 = uncached.resolve("./lib/util", NO_ITEMS);
    assertEquals(first, fresh1);
    assertEquals(fresh1, fresh2);
    assertEquals(2 * probesAfterFirst, prober2.calls.get());

    ImportResolver.ResolverStats stats = cached.getStats();
    assertEquals(1, stats.cacheHits);
    assertEquals(1, stats.cacheMisses);
    assertEquals(1, stats.resolvedEntries);
  }

  @Test
  public void testItemsArePartOfTheKey() {
    ImportResolver r = resolver(new CountingProber()).build();
    r.resolve("@flutterjs/material", Arrays.asList("Text"));
    r.resolve("@flutterjs/material", Arrays.asList("Text", "Row"));
    assertEquals(2, r.getStats().resolvedEntries);
    assertEquals(0, r.getStats().cacheHits);
  }

  @Test
  public void testUnresolvedScopedPackage() {
    CountingProber prober = new CountingProber();
    ResolutionResult res = resolver(prober).build()
                              .resolve("@acme/widgets", NO_ITEMS);
    assertFalse(res.isValid());
    assertEquals(ResolutionType.ERROR, res.getType());
    assertEquals("Scoped packages skip local lookup", 0, prober.calls.get());
    assertEquals(1, res.getFallbacks().size());
    assertEquals(FallbackStep.PACKAGE_CACHE,
                 res.getFallbacks().get(0).getStrategyTried());
    assertTrue(res.getReason(),
        res.getReason().startsWith("Cannot resolve import \"@acme/widgets\""));
  }

  @Test
  public void testUnknownFrameworkPackage() {
    ResolutionResult res = resolver(new CountingProber()).build()
                              .resolve("@flutterjs/charts", NO_ITEMS);
    assertFalse(res.isValid());
    List<String> strategies = new ArrayList<String>();
    for (FallbackStep f: res.getFallbacks()) {
      strategies.add(f.getStrategyTried());
      assertFalse(f.isFound());
    }
    assertEquals(Arrays.asList(FallbackStep.FRAMEWORK_PACKAGE,
                               FallbackStep.PACKAGE_CACHE), strategies);
  }

  @Test
  public void testPackageCache() {
    CountingProber prober = new CountingProber("/cache/left-pad/index.js");
    ResolutionResult res = resolver(prober).packageCacheDir("/cache")
        .build().resolve("left-pad", NO_ITEMS);
    assertEquals(ResolutionType.CACHE, res.getType());
    assertEquals("/cache/left-pad/index.js", res.getActualPath());
    assertEquals("Local lookup was tried first", 1,
                 res.getFallbacks().size());
    assertEquals(FallbackStep.LOCAL_CODE,
                 res.getFallbacks().get(0).getStrategyTried());
  }

  @Test
  public void testCustomMappingDropsStaleFailure() {
    ImportResolver r = resolver(new CountingProber()).build();
    assertFalse(r.resolve("@flutterjs/extra", NO_ITEMS).isValid());
    assertEquals(1, r.getStats().unresolvedEntries);

    r.addCustomMapping("@flutterjs/extra", "@flutterjs/runtime");
    ResolutionResult res = r.resolve("@flutterjs/extra", NO_ITEMS);
    assertEquals(ResolutionType.FRAMEWORK, res.getType());
    assertEquals("@flutterjs/runtime", res.getResolved());
  }

  @Test
  public void testClearCache() {
    ImportResolver r = resolver(new CountingProber()).build();
    r.resolve("@flutterjs/vdom", NO_ITEMS);
    r.resolve("@flutterjs/vdom", NO_ITEMS);
    r.clearCache();
    ImportResolver.ResolverStats stats = r.getStats();
    assertEquals(0, stats.cacheHits);
    assertEquals(0, stats.resolvedEntries);
  }

  @Test
  public void testConcurrentResolution() throws Exception {
    final ImportResolver r = resolver(
        new CountingProber("/proj/src/shared.js")).build();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<ResolutionResult>> futures =
          new ArrayList<Future<ResolutionResult>>();
      for (int i = 0; i < 16; i++) {
        futures.add(pool.submit(new Callable<ResolutionResult>() {
          @Override
          public ResolutionResult call() {
            return r.resolve("shared", NO_ITEMS);
          }
        }));
      }
      ResolutionResult expected = futures.get(0).get();
      assertEquals(ResolutionType.LOCAL, expected.getType());
      for (Future<ResolutionResult> f: futures) {
        assertEquals(expected, f.get());
      }
    } finally {
      pool.shutdown();
    }
    assertEquals(1, r.getStats().resolvedEntries);
  }
}
