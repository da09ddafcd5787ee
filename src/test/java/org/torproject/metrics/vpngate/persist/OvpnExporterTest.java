/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.persist;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.torproject.metrics.vpngate.model.Server;
import org.torproject.metrics.vpngate.model.ServerConfig;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

public class OvpnExporterTest {

  @Rule
  public TemporaryFolder tmpf = new TemporaryFolder();

  private Path ovpnDir;

  private OvpnExporter exporter;

  @Before
  public void setUp() {
    this.ovpnDir = tmpf.getRoot().toPath().resolve("ovpn");
    this.exporter = new OvpnExporter(this.ovpnDir);
  }

  private static Server server(String name, String blob) {
    return new Server(new ServerConfig(name, null, "JP", "Japan", "2weeks",
        "op", "", blob));
  }

  @Test
  public void testExport() throws Exception {
    assertTrue(this.exporter.export(server("public-vpn-227",
        "Y2xpZW50CmRldiB0dW4K")));
    Path profile = this.ovpnDir.resolve("public-vpn-227.ovpn");
    assertEquals("client\ndev tun\n", new String(Files.readAllBytes(profile),
        StandardCharsets.UTF_8));
  }

  @Test
  public void testExportReplacesProfile() throws Exception {
    this.exporter.export(server("vpn1", "Y2xpZW50CmRldiB0dW4K"));
    this.exporter.export(server("vpn1", "Y2xpZW50Cg=="));
    assertEquals("client\n", new String(Files.readAllBytes(
        this.ovpnDir.resolve("vpn1.ovpn")), StandardCharsets.UTF_8));
  }

  @Test
  public void testInvalidProfilesAreSkipped() {
    assertFalse(this.exporter.export(server("vpn1", "")));
    assertFalse(this.exporter.export(server("vpn2", null)));
    assertFalse(this.exporter.export(server("vpn3", "not*base64!")));
    assertFalse(this.exporter.export(server("../vpn4", "Y2xpZW50Cg==")));
    assertFalse(Files.exists(this.ovpnDir));
  }

  @Test
  public void testExportAllAndRemove() throws Exception {
    assertEquals(2, this.exporter.exportAll(Arrays.asList(
        server("vpn1", "Y2xpZW50Cg=="), server("vpn2", "?"),
        server("vpn3", "Y2xpZW50Cg=="))));
    assertTrue(this.exporter.remove("vpn1"));
    assertFalse(this.exporter.remove("vpn1"));
    assertFalse(Files.exists(this.ovpnDir.resolve("vpn1.ovpn")));
    assertTrue(Files.exists(this.ovpnDir.resolve("vpn3.ovpn")));
  }
}
