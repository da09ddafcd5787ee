/* Copyright 2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.vpngate.downloader;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for downloading snapshots from HTTP servers.
 */
public class Downloader {

  /**
   * Download the given URL from an HTTP server and return downloaded bytes.
   *
   * @param url URL to download.
   * @param timeoutMillis Connect and read timeout in milliseconds.
   * @return Downloaded bytes, or {@code null} if the resource was not found.
   * @throws IOException Thrown if anything goes wrong while downloading, or
   *     if the server announces anything but text.
   */
  public static byte[] downloadFromHttpServer(URL url, int timeoutMillis)
      throws IOException {
    ByteArrayOutputStream downloadedBytes = new ByteArrayOutputStream();
    HttpURLConnection huc = (HttpURLConnection) url.openConnection();
    huc.setRequestMethod("GET");
    huc.setConnectTimeout(timeoutMillis);
    huc.setReadTimeout(timeoutMillis);
    huc.connect();
    int response = huc.getResponseCode();
    if (response != 200) {
      return null;
    }
    String contentType = huc.getContentType();
    if (null != contentType && !contentType.trim().toLowerCase()
        .startsWith("text/")) {
      throw new IOException("Expected text from " + url + ", but got "
          + contentType + ".");
    }
    try (BufferedInputStream in
        = new BufferedInputStream(huc.getInputStream())) {
      int len;
      byte[] data = new byte[1024];
      while ((len = in.read(data, 0, 1024)) >= 0) {
        downloadedBytes.write(data, 0, len);
      }
    }
    return downloadedBytes.toByteArray();
  }

  /**
   * Download the given URL and decode the response as UTF-8 text.
   *
   * @return Downloaded text, or {@code null} if the resource was not found.
   */
  public static String downloadText(URL url, int timeoutMillis)
      throws IOException {
    byte[] downloadedBytes = downloadFromHttpServer(url, timeoutMillis);
    return null == downloadedBytes ? null
        : new String(downloadedBytes, StandardCharsets.UTF_8);
  }
}
