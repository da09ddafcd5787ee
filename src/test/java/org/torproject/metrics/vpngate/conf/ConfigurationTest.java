/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.conf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.EnumSet;
import java.util.Properties;
import java.util.Random;
import java.util.Set;

public class ConfigurationTest {

  private Random randomSource = new Random();

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  @Test()
  public void testKeyCount() throws Exception {
    assertEquals("The number of properties keys in enum Key changed."
        + "\n This test class should be adapted.",
        14, Key.values().length);
  }

  private String propLine(Key key, String val) {
    return key.name() + " = " + val + "\n";
  }

  @Test()
  public void testBoolValues() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.ExportOvpnFiles.name(), "false");
    conf.setProperty(Key.RunOnce.name(), "trUe");
    assertFalse(conf.getBool(Key.ExportOvpnFiles));
    assertTrue(conf.getBool(Key.RunOnce));
  }

  @Test()
  public void testIntValues() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.DownloadTimeoutMillis.name(), "inf");
    assertEquals(Integer.MAX_VALUE, conf.getInt(Key.DownloadTimeoutMillis));
    int randomInt = randomSource.nextInt(Integer.MAX_VALUE);
    conf = new Configuration();
    conf.load(new ByteArrayInputStream(
        propLine(Key.HarvestPeriodMinutes, "" + randomInt).getBytes()));
    assertEquals(randomInt, conf.getInt(Key.HarvestPeriodMinutes));
  }

  @Test()
  public void testLongValues() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.ShutdownGraceWaitMinutes.name(), " 25 ");
    assertEquals(25L, conf.getLong(Key.ShutdownGraceWaitMinutes));
  }

  @Test()
  public void testFileValues() throws Exception {
    String[] files = new String[] { "/the/path/file.txt", "another/path"};
    for (String file : files) {
      Configuration conf = new Configuration();
      conf.setProperty(Key.OutputPath.name(), file);
      assertEquals(new File(file), conf.getPath(Key.OutputPath).toFile());
    }
  }

  @Test()
  public void testSourceTypeValues() throws Exception {
    String[] types = new String[] { "Local", "Remote"};
    for (String type : types) {
      Configuration conf = new Configuration();
      conf.setProperty(Key.SnapshotSources.name(), type);
      Set<SourceType> sts = conf.getSourceTypeSet(Key.SnapshotSources);
      assertEquals(1, sts.size());
      assertTrue(sts.contains(SourceType.valueOf(type)));
    }
    Configuration conf = new Configuration();
    conf.setProperty(Key.SnapshotSources.name(), "Remote, Local");
    assertEquals(EnumSet.allOf(SourceType.class),
        conf.getSourceTypeSet(Key.SnapshotSources));
  }

  @Test()
  public void testUrlValue() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.SnapshotUrl.name(),
        "http://www.vpngate.net/api/iphone/");
    assertEquals(new URL("http://www.vpngate.net/api/iphone/"),
        conf.getUrl(Key.SnapshotUrl));
  }

  @Test(expected = ConfigurationException.class)
  public void testSourceTypeValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.SnapshotSources.name(), "Remote, Sync");
    conf.getSourceTypeSet(Key.SnapshotSources);
  }

  @Test(expected = ConfigurationException.class)
  public void testBoolValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.SnapshotUrl.name(), "http://x.y.z");
    conf.getBool(Key.SnapshotUrl);
  }

  @Test(expected = ConfigurationException.class)
  public void testPathValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.SnapshotLocalOrigins.name(), "\\\u0000:");
    conf.getPath(Key.SnapshotLocalOrigins);
  }

  @Test(expected = ConfigurationException.class)
  public void testUrlValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.SnapshotUrl.name(), "xxx://y.y.y");
    conf.getUrl(Key.SnapshotUrl);
  }

  @Test(expected = ConfigurationException.class)
  public void testIntValueException() throws Exception {
    Configuration conf = new Configuration();
    conf.setProperty(Key.HarvestPeriodMinutes.name(), "y7");
    conf.getInt(Key.HarvestPeriodMinutes);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingValue() throws Exception {
    new Configuration().getPath(Key.StorePath);
  }

  @Test(expected = ConfigurationException.class)
  public void testMissingFile() throws Exception {
    new Configuration().loadAndCheckConfiguration(
        Paths.get("/tmp/phantom.path"));
  }

  @Test(expected = ConfigurationException.class)
  public void testNothingActivated() throws Exception {
    Path confPath = tmpf.newFile("harvester.properties").toPath();
    Files.write(confPath, "HarvestActivated = false\n".getBytes());
    new Configuration().loadAndCheckConfiguration(confPath);
  }

  @Test()
  public void testDefaultConfiguration() throws Exception {
    Configuration conf = new Configuration();
    try (InputStream in = getClass().getClassLoader()
        .getResourceAsStream("harvester.properties")) {
      conf.load(in);
    }
    Properties defaults = conf.getPropertiesCopy();
    assertEquals(Key.values().length, defaults.size());
    for (Key key : Key.values()) {
      assertTrue("Missing default for " + key,
          null != defaults.getProperty(key.name()));
    }
    assertFalse(conf.getBool(Key.HarvestActivated));
    assertEquals(EnumSet.of(SourceType.Remote),
        conf.getSourceTypeSet(Key.SnapshotSources));
    assertEquals(60, conf.getInt(Key.HarvestPeriodMinutes));
  }
}
