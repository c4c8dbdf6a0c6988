/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.skymaps.cache;

import org.skymaps.common.render.TileImage;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import net.spy.memcached.AddrUtil;
import net.spy.memcached.ConnectionFactoryBuilder;
import net.spy.memcached.FailureMode;
import net.spy.memcached.MemcachedClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

/**
 * A store shared between processes, held in memcached.
 * <p>
 * Every operation is bounded by the timeout.  The tile is always available by computing it again, so failures of the
 * memcached cluster (timeouts, refused connections, cancelled operations, oversized items) are logged and reported as
 * a miss or an unsuccessful write.
 */
public class SharedCacheStore implements CacheStore, DisposableBean {
  private static final Logger LOG = LoggerFactory.getLogger(SharedCacheStore.class);

  private final MemcachedClient client;
  private final long timeoutMillis;
  private final int maxItemBytes;
  private final int ttlSeconds;

  /**
   * @param client connected to the memcached servers
   * @param timeoutMillis the longest a caller waits for one operation
   * @param maxItemBytes items larger than this, content type included, are not stored
   * @param ttlSeconds expiry of stored entries, 0 for none
   */
  public SharedCacheStore(MemcachedClient client, long timeoutMillis, int maxItemBytes, int ttlSeconds) {
    Preconditions.checkArgument(timeoutMillis > 0, "The memcached timeout must be positive");
    Preconditions.checkArgument(ttlSeconds >= 0, "The memcached TTL cannot be negative");
    this.client = client;
    this.timeoutMillis = timeoutMillis;
    this.maxItemBytes = maxItemBytes;
    this.ttlSeconds = ttlSeconds;
  }

  /**
   * @param servers space or comma separated {@code host:port} addresses
   */
  public static SharedCacheStore connect(String servers, long timeoutMillis, int maxItemBytes, int ttlSeconds)
    throws IOException {
    MemcachedClient client = new MemcachedClient(
      new ConnectionFactoryBuilder()
        .setOpTimeout(timeoutMillis)
        .setFailureMode(FailureMode.Cancel)
        .setDaemon(true)
        .build(),
      AddrUtil.getAddresses(servers));
    LOG.info("Connected to memcached at {}", servers);
    return new SharedCacheStore(client, timeoutMillis, maxItemBytes, ttlSeconds);
  }

  @Override
  public Optional<TileImage> get(String key) {
    Future<Object> future = null;
    try {
      future = client.asyncGet(key);
      Object value = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
      if (value instanceof byte[]) {
        return Optional.of(decode((byte[]) value));
      } else if (value != null) {
        LOG.warn("Ignoring unexpected {} in memcached for {}", value.getClass().getName(), key);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted reading {} from memcached", key);
    } catch (TimeoutException e) {
      LOG.warn("Timed out after {}ms reading {} from memcached", timeoutMillis, key);
      future.cancel(false);
    } catch (ExecutionException | RuntimeException e) {
      LOG.warn("Unable to read {} from memcached: {}", key, e.getMessage());
    } catch (IOException e) {
      LOG.warn("Ignoring a corrupt entry in memcached for {}", key, e);
    }
    return Optional.empty();
  }

  @Override
  public boolean set(String key, TileImage image) {
    byte[] item = encode(image);
    if (!fitsItemLimit(item)) {
      LOG.warn("Not storing {} in memcached: {} bytes exceeds the {} byte item limit", key, item.length,
               maxItemBytes);
      return false;
    }
    try {
      // add rather than set: an existing entry is never replaced
      return Boolean.TRUE.equals(client.add(key, ttlSeconds, item).get(timeoutMillis, TimeUnit.MILLISECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.warn("Interrupted writing {} to memcached", key);
    } catch (TimeoutException e) {
      LOG.warn("Timed out after {}ms writing {} to memcached", timeoutMillis, key);
    } catch (ExecutionException | RuntimeException e) {
      LOG.warn("Unable to write {} to memcached: {}", key, e.getMessage());
    }
    return false;
  }

  /**
   * The limit applies to the whole item, content type included.
   */
  @VisibleForTesting
  boolean fitsItemLimit(byte[] item) {
    return item.length <= maxItemBytes;
  }

  /**
   * Items are the content type, written in modified UTF-8, followed by the image bytes.  The plain byte array is left
   * untouched by the memcached transcoder, so no Java serialization is involved.
   */
  @VisibleForTesting
  static byte[] encode(TileImage image) {
    ByteArrayDataOutput out = ByteStreams.newDataOutput(image.length() + 32);
    out.writeUTF(image.getContentType());
    out.write(image.getBytes());
    return out.toByteArray();
  }

  @VisibleForTesting
  static TileImage decode(byte[] item) throws IOException {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(item))) {
      String contentType = in.readUTF();
      byte[] bytes = new byte[in.available()];
      in.readFully(bytes);
      return new TileImage(bytes, contentType);
    }
  }

  @Override
  public void destroy() {
    client.shutdown(timeoutMillis, TimeUnit.MILLISECONDS);
  }
}
