/*
 * (C) Copyright 2016 Kurento (http://kurento.org/)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.kurento.gateway;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AppReadyWaiterTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test(timeout = 1000)
  public void autoInitDoesNotWait() throws InterruptedException {
    new AppReadyWaiter(true, "/nonexistent/appready").await();
  }

  @Test(timeout = 5000)
  public void waitsForReadyFile() throws Exception {
    final File ready = new File(folder.getRoot(), "appready");
    final AppReadyWaiter waiter = new AppReadyWaiter(false, ready.getPath());
    final CountDownLatch done = new CountDownLatch(1);
    Thread thread = new Thread(new Runnable() {
      @Override
      public void run() {
        try {
          waiter.await();
          done.countDown();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    });
    thread.start();

    assertFalse(done.await(3 * AppReadyWaiter.POLL_MILLIS, TimeUnit.MILLISECONDS));
    assertTrue(ready.createNewFile());
    assertTrue(done.await(2, TimeUnit.SECONDS));
  }
}
