/*
 * Copyright 2023-2043 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.asyncdb.mysql.protocol.client;

import io.asyncdb.mysql.env.Environment;
import io.asyncdb.mysql.env.MySQLHost;
import io.asyncdb.mysql.env.MySQLKey;
import io.asyncdb.mysql.protocol.BinaryRowDecoder;
import io.asyncdb.mysql.protocol.FrameCodec;
import io.asyncdb.mysql.protocol.MySQLHandlerDelegate;
import io.asyncdb.mysql.protocol.TextDecoderRegistry;
import io.netty.channel.EventLoopGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.resources.LoopResources;
import reactor.util.annotation.Nullable;

import java.nio.charset.Charset;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * <p>
 * This class is connection(handler) factory of one {@link MySQLHost}. All handlers of a factory share
 * its event loops and its result scheduler.
 * </p>
 *
 * @since 1.0
 */
public final class ClientConnectionFactory {

    public static ClientConnectionFactory from(MySQLHost host, Supplier<? extends FrameCodec> codecFactory) {
        return from(host, codecFactory, DefaultTextDecoderRegistry.INSTANCE, null);
    }

    /**
     * @param binaryRowDecoder null : {@link DefaultBinaryRowDecoder}
     */
    public static ClientConnectionFactory from(MySQLHost host, Supplier<? extends FrameCodec> codecFactory,
                                               TextDecoderRegistry textDecoders,
                                               @Nullable BinaryRowDecoder binaryRowDecoder) {
        return new ClientConnectionFactory(host, codecFactory, textDecoders, binaryRowDecoder);
    }

    private static final Logger LOG = LoggerFactory.getLogger(ClientConnectionFactory.class);

    final MySQLHost host;

    final Charset charset;

    final Supplier<? extends FrameCodec> codecFactory;

    final TextDecoderRegistry textDecoders;

    final BinaryRowDecoder binaryRowDecoder;

    final Scheduler resultScheduler;

    private final LoopResources loopResources;

    private final AtomicLong connectionSequence = new AtomicLong(0);

    private ClientConnectionFactory(MySQLHost host, Supplier<? extends FrameCodec> codecFactory,
                                    TextDecoderRegistry textDecoders, @Nullable BinaryRowDecoder binaryRowDecoder) {
        this.host = host;
        this.codecFactory = Objects.requireNonNull(codecFactory, "codecFactory");
        this.textDecoders = Objects.requireNonNull(textDecoders, "textDecoders");

        final Environment env = host.properties();
        this.charset = env.getOrDefault(MySQLKey.CHARACTER_ENCODING);
        if (binaryRowDecoder == null) {
            this.binaryRowDecoder = DefaultBinaryRowDecoder.create(this.charset);
        } else {
            this.binaryRowDecoder = binaryRowDecoder;
        }
        this.resultScheduler = env.get(MySQLKey.RESULT_SCHEDULER, Schedulers::boundedElastic);
        this.loopResources = createEventLoopGroup(env);
    }


    public String factoryName() {
        return this.host.properties().getOrDefault(MySQLKey.FACTORY_NAME);
    }

    /**
     * <p>
     * Create a handler, the transport is opened by {@link MySQLConnectionHandler#connect()}.
     * <br/>
     */
    public MySQLConnectionHandler newHandler(final MySQLHandlerDelegate delegate) {
        if (this.loopResources.isDisposed()) {
            throw new IllegalStateException(String.format("%s have closed.", this));
        }
        final String connectionId;
        connectionId = this.factoryName() + "-" + this.connectionSequence.incrementAndGet();
        LOG.debug("create connection handler {}", connectionId);
        return MySQLConnectionHandler.create(this, Objects.requireNonNull(delegate, "delegate"), connectionId);
    }

    public Mono<Void> close() {
        if (this.loopResources.isDisposed()) {
            return Mono.empty();
        }

        final Environment env = this.host.properties();

        final Duration shutdownQuietPeriod, shutdownTimeout;
        shutdownQuietPeriod = Duration.ofMillis(env.getOrDefault(MySQLKey.SHUTDOWN_QUIET_PERIOD));
        shutdownTimeout = Duration.ofMillis(env.getOrDefault(MySQLKey.SHUTDOWN_TIMEOUT));

        return this.loopResources.disposeLater(shutdownQuietPeriod, shutdownTimeout)
                .doOnSuccess(v -> LOG.debug("{} closed", this));
    }

    public boolean isClosed() {
        return this.loopResources.isDisposed();
    }

    @Override
    public String toString() {
        return new StringBuilder()
                .append(getClass().getName())
                .append("[ name : ")
                .append(this.factoryName())
                .append(" , host : ")
                .append(this.host.host())
                .append(':')
                .append(this.host.port())
                .append(" , hash : ")
                .append(System.identityHashCode(this))
                .append(" ]")
                .toString();
    }

    /*-------------------below package method -------------------*/

    /**
     * @see MySQLConnectionHandler#connect()
     */
    EventLoopGroup eventLoopGroup() {
        // NIO loops, MySQLConnectionHandler connect with NioSocketChannel
        return this.loopResources.onClient(false);
    }


    /*-------------------below static method -------------------*/

    private static LoopResources createEventLoopGroup(final Environment env) {
        final int workerCount;
        workerCount = env.getInRange(MySQLKey.FACTORY_WORKER_COUNT, 1, Integer.MAX_VALUE);
        int selectCount;
        selectCount = env.getOrDefault(MySQLKey.FACTORY_SELECT_COUNT);
        if (selectCount < 0) {
            selectCount = workerCount;
        }
        return LoopResources.create("asyncdb-mysql", selectCount, workerCount, true);
    }


}
