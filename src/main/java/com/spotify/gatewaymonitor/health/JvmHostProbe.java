/*-
 * -\-\-
 * gateway-monitor
 * --
 * Copyright (C) 2024 Spotify AB
 * --
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * -/-/-
 */

package com.spotify.gatewaymonitor.health;

import com.sun.management.OperatingSystemMXBean;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Host readings from the operating-system MXBean and the file store of the working directory. */
public class JvmHostProbe implements HostProbe {

  static final double LATENCY_ESTIMATE_MS = 50.0;

  private final OperatingSystemMXBean osBean;
  private final Path diskPath;

  public JvmHostProbe() {
    this(Paths.get("").toAbsolutePath());
  }

  public JvmHostProbe(final Path diskPath) {
    this.osBean = (OperatingSystemMXBean) ManagementFactory.getOperatingSystemMXBean();
    this.diskPath = diskPath;
  }

  @Override
  public double cpuUsage() {
    final double load = osBean.getCpuLoad();
    // negative when the platform cannot tell yet
    if (load < 0) {
      throw new IllegalStateException("CPU load not available");
    }
    return load * 100.0;
  }

  @Override
  public double memoryUsage() {
    final long total = osBean.getTotalMemorySize();
    if (total <= 0) {
      throw new IllegalStateException("Physical memory size not available");
    }
    return (total - osBean.getFreeMemorySize()) * 100.0 / total;
  }

  @Override
  public double diskUsage() {
    try {
      final FileStore store = Files.getFileStore(diskPath);
      final long total = store.getTotalSpace();
      if (total <= 0) {
        throw new IllegalStateException("Disk size not available for " + diskPath);
      }
      return (total - store.getUsableSpace()) * 100.0 / total;
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public double networkLatency() {
    return LATENCY_ESTIMATE_MS;
  }
}
