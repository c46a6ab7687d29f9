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

package com.spotify.gatewaymonitor.alert;

import com.spotify.gatewaymonitor.db.Alert;
import com.spotify.gatewaymonitor.db.ThresholdConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes notifications to the log instead of a real transport. */
public class LoggingNotifier implements Notifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(LoggingNotifier.class);

  @Override
  public void send(final Alert alert, final ThresholdConfig config) {
    for (final String channel : alert.notificationChannels()) {
      LOGGER.info(
          "[{}] {} ({}): {} -> {}",
          channel,
          alert.title(),
          alert.severity().value(),
          alert.message(),
          config.notificationRecipients());
    }
  }
}
