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

import static io.resilient.amqp.Resource.State.DISCONNECTED;

import io.resilient.amqp.Resource;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class ResourceBase implements Resource {

  private static final Logger LOGGER = LoggerFactory.getLogger(ResourceBase.class);

  private final AtomicReference<State> state = new AtomicReference<>(DISCONNECTED);
  private final EventSupport eventSupport;

  ResourceBase(List<EventListener> listeners) {
    this.eventSupport = new EventSupport(listeners);
  }

  @Override
  public State state() {
    return this.state.get();
  }

  @Override
  public void addListener(EventListener listener) {
    this.eventSupport.add(listener);
  }

  @Override
  public void removeListener(EventListener listener) {
    this.eventSupport.remove(listener);
  }

  protected void state(Resource.State state) {
    Resource.State previousState = this.state.getAndSet(state);
    if (state != previousState && LOGGER.isDebugEnabled()) {
      LOGGER.debug("{} went from {} to {}", this, previousState, state);
    }
  }

  protected void dispatch(Event event) {
    this.dispatch(event, null);
  }

  protected void dispatch(Event event, Throwable failureCause) {
    this.eventSupport.dispatch(this, event, failureCause);
  }
}
