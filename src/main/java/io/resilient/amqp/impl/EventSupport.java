// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.resilient.amqp.impl;

import io.resilient.amqp.Resource;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class EventSupport {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventSupport.class);

  private final List<Resource.EventListener> listeners;

  EventSupport(List<Resource.EventListener> listeners) {
    this.listeners = new CopyOnWriteArrayList<>(listeners);
  }

  void add(Resource.EventListener listener) {
    this.listeners.add(listener);
  }

  void remove(Resource.EventListener listener) {
    this.listeners.remove(listener);
  }

  void dispatch(Resource resource, Resource.Event event, Throwable failureCause) {
    if (!this.listeners.isEmpty()) {
      Resource.Context context = new DefaultContext(resource, event, failureCause);
      this.listeners.forEach(
          l -> {
            try {
              l.handle(context);
            } catch (Exception e) {
              LOGGER.warn("Error in resource listener for event {}", event, e);
            }
          });
    }
  }

  private static class DefaultContext implements Resource.Context {

    private final Resource resource;
    private final Resource.Event event;
    private final Throwable failureCause;

    private DefaultContext(Resource resource, Resource.Event event, Throwable failureCause) {
      this.resource = resource;
      this.event = event;
      this.failureCause = failureCause;
    }

    @Override
    public Resource resource() {
      return this.resource;
    }

    @Override
    public Resource.Event event() {
      return this.event;
    }

    @Override
    public Throwable failureCause() {
      return this.failureCause;
    }

    @Override
    public String toString() {
      return "Context{event=" + event + ", failureCause=" + failureCause + '}';
    }
  }
}
