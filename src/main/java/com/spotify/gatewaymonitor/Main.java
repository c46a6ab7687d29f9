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

package com.spotify.gatewaymonitor;

import com.spotify.gatewaymonitor.di.CacheModule;
import com.spotify.gatewaymonitor.di.ConfigModule;
import com.spotify.gatewaymonitor.di.DatabaseModule;
import com.spotify.gatewaymonitor.di.HttpServerModule;
import com.spotify.gatewaymonitor.di.MetricsModule;
import com.spotify.gatewaymonitor.di.MonitoringModule;
import com.spotify.gatewaymonitor.di.NotifierModule;
import com.spotify.gatewaymonitor.di.ObjectMapperModule;
import dagger.Component;
import javax.inject.Singleton;
import org.slf4j.bridge.SLF4JBridgeHandler;

/** Application entry point. */
public final class Main {

  public static final String SERVICE_NAME = "gateway-monitor";

  @Singleton
  @Component(
      modules = {
        ConfigModule.class,
        DatabaseModule.class,
        CacheModule.class,
        HttpServerModule.class,
        MetricsModule.class,
        NotifierModule.class,
        ObjectMapperModule.class,
        MonitoringModule.class,
      })
  public interface MonitorComponent {
    Application configure();
  }

  /**
   * Runs the application.
   *
   * @param args command-line arguments
   */
  public static void main(final String... args) throws Exception {
    SLF4JBridgeHandler.removeHandlersForRootLogger();
    SLF4JBridgeHandler.install();
    final MonitorComponent monitor = DaggerMain_MonitorComponent.builder().build();
    monitor.configure().start();
  }
}
