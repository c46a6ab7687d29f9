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

package com.spotify.gatewaymonitor.di;

import com.spotify.gatewaymonitor.api.Endpoint;
import com.spotify.gatewaymonitor.api.HealthCheck;
import com.spotify.gatewaymonitor.api.MonitoringResources;
import com.spotify.gatewaymonitor.api.PerformanceResources;
import com.spotify.gatewaymonitor.api.ScalabilityResources;
import dagger.Binds;
import dagger.Module;
import dagger.multibindings.IntoSet;

@Module
public abstract class EndpointsModule {

  @Binds
  @IntoSet
  public abstract Endpoint healthCheck(HealthCheck healthCheck);

  @Binds
  @IntoSet
  public abstract Endpoint monitoringResources(MonitoringResources monitoringResources);

  @Binds
  @IntoSet
  public abstract Endpoint performanceResources(PerformanceResources performanceResources);

  @Binds
  @IntoSet
  public abstract Endpoint scalabilityResources(ScalabilityResources scalabilityResources);
}
