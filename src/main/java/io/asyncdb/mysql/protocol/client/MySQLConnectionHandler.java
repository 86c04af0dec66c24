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
import io.asyncdb.mysql.protocol.message.client.*;
import io.asyncdb.mysql.protocol.message.server.*;
import io.asyncdb.mysql.util.MySQLExceptions;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.channel.*;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.annotation.Nullable;

import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.util.List;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

/**
 * <p>
 * Protocol engine of one MySQL connection. This handler sits after the frame codec, turns the
 * {@link ServerMessage}s of each exchange into {@link MySQLHandlerDelegate} events and owns the prepared
 * statement cache of the connection.
 * <br/>
 * <p>
 * Inbound dispatch always runs on the I/O thread of the channel, so {@link ExchangeState} and the
 * statement cache have no lock. The caller must serialize exchanges : at most one query, prepared
 * statement or handshake response may be in flight, a second request written before the first
 * terminated (ok / error / eof) interleaves with it and the results are undefined. There is no queue here.
 * <br/>
 * <p>
 * The connect outcome returned by {@link #connect()} fails when the transport can't connect, when
 * {@link #exceptionCaught(ChannelHandlerContext, Throwable)} happens first or when the channel closes first.
 * It succeeds only by {@link #connectionSucceeded()}, the delegate invokes it after the server accepted the
 * handshake response.
 * <br/>
 *
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_command_phase.html">Command Phase</a>
 * @see <a href="https://dev.mysql.com/doc/dev/mysql-server/latest/page_protocol_command_phase_ps.html">Prepared Statements</a>
 * @since 1.0
 */
public final class MySQLConnectionHandler extends SimpleChannelInboundHandler<Object> {

    static MySQLConnectionHandler create(ClientConnectionFactory factory, MySQLHandlerDelegate delegate,
                                         String connectionId) {
        return new MySQLConnectionHandler(factory, delegate, connectionId);
    }

    private static final Logger LOG = LoggerFactory.getLogger(MySQLConnectionHandler.class);

    private static final AtomicIntegerFieldUpdater<MySQLConnectionHandler> CONNECT_DONE =
            AtomicIntegerFieldUpdater.newUpdater(MySQLConnectionHandler.class, "connectDone");

    private static final AtomicIntegerFieldUpdater<MySQLConnectionHandler> SERVER_STATUS =
            AtomicIntegerFieldUpdater.newUpdater(MySQLConnectionHandler.class, "serverStatus");

    private final ClientConnectionFactory factory;

    private final MySQLHandlerDelegate delegate;

    private final String connectionId;

    private final FrameCodec codec;

    private final TextDecoderRegistry textDecoders;

    private final BinaryRowDecoder binaryRowDecoder;

    private final Charset charset;

    private final Scheduler scheduler;

    private final Sinks.One<MySQLConnectionHandler> connectionSink = Sinks.one();

    private final PreparedStatementCache preparedStatements = new PreparedStatementCache();

    private final ChannelFutureListener writeErrorListener = this::onWriteComplete;

    private volatile int connectDone = 0;

    private volatile int serverStatus = 0;

    private volatile ConnectionState state = ConnectionState.CONNECTING;

    private volatile ChannelHandlerContext currentContext;

    private ExchangeState exchange = ExchangeState.idle();

    /**
     * true from the request of an exchange until its ok / error / eof, only accessed in event loop.
     */
    private boolean exchangeInFlight;

    private MySQLConnectionHandler(ClientConnectionFactory factory, MySQLHandlerDelegate delegate,
                                   String connectionId) {
        this.factory = factory;
        this.delegate = delegate;
        this.connectionId = connectionId;
        this.codec = factory.codecFactory.get();
        this.textDecoders = factory.textDecoders;
        this.binaryRowDecoder = factory.binaryRowDecoder;
        this.charset = factory.charset;
        this.scheduler = factory.resultScheduler;
    }


    /*################################## blow lifecycle method ##################################*/

    /**
     * <p>
     * Open the transport and install frame codec and this handler.
     * <br/>
     *
     * @return the connect outcome, see class doc.
     */
    public Mono<MySQLConnectionHandler> connect() {
        final MySQLHost host = this.factory.host;
        final Environment env = host.properties();
        final FrameCodec codec = this.codec;

        final Bootstrap bootstrap = new Bootstrap()
                .group(this.factory.eventLoopGroup())
                .channel(NioSocketChannel.class)
                .option(ChannelOption.SO_KEEPALIVE, env.isOn(MySQLKey.TCP_KEEP_ALIVE))
                .option(ChannelOption.TCP_NODELAY, env.isOn(MySQLKey.TCP_NO_DELAY))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, env.getOrDefault(MySQLKey.CONNECT_TIMEOUT))
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel channel) {
                        channel.pipeline().addLast(codec.decoder(), codec.encoder(), MySQLConnectionHandler.this);
                    }
                });

        LOG.debug("[{}] connecting {}", this.connectionId, host);
        bootstrap.connect(InetSocketAddress.createUnresolved(host.host(), host.port()))
                .addListener((ChannelFutureListener) future -> {
                    if (!future.isSuccess()) {
                        this.onConnectFailure(future.cause());
                    }
                });
        return this.connectOutcome();
    }

    /**
     * <p>
     * Complete the connect outcome successfully, no-op if it has completed.
     * <br/>
     *
     * @return true : this invocation completed the outcome
     */
    public boolean connectionSucceeded() {
        if (!CONNECT_DONE.compareAndSet(this, 0, 1)) {
            return false;
        }
        final Sinks.EmitResult result = this.connectionSink.tryEmitValue(this);
        if (result.isFailure()) {
            LOG.warn("[{}] emit connect outcome failure, {}", this.connectionId, result);
        }
        LOG.debug("[{}] connect outcome success", this.connectionId);
        return true;
    }

    /**
     * @return the connect outcome, completes at most once.
     */
    public Mono<MySQLConnectionHandler> connectOutcome() {
        return this.connectionSink.asMono()
                .publishOn(this.scheduler);
    }

    public boolean isConnectCompleted() {
        return this.connectDone != 0;
    }

    public Mono<Void> disconnect() {
        final ChannelHandlerContext ctx = this.currentContext;
        if (ctx == null) {
            this.state = ConnectionState.CLOSED;
            return Mono.empty();
        }
        LOG.debug("[{}] disconnect", this.connectionId);
        return toMono(ctx.close());
    }

    public boolean isConnected() {
        final ChannelHandlerContext ctx = this.currentContext;
        return ctx != null && ctx.channel().isActive();
    }

    public ConnectionState state() {
        return this.state;
    }

    public String connectionId() {
        return this.connectionId;
    }

    /**
     * @return status flags of last ok / eof
     */
    public int serverStatus() {
        return this.serverStatus;
    }

    public boolean inTransaction() {
        return Terminator.inTransaction(this.serverStatus);
    }


    /*################################## blow write method ##################################*/

    public Mono<Void> write(final QueryMessage message) {
        final ChannelHandlerContext ctx = this.writableContext();
        if (ctx == null) {
            return Mono.error(MySQLExceptions.sessionHaveClosed());
        }
        final ChannelPromise promise = ctx.newPromise();
        this.runInEventLoop(ctx, () -> this.writeQuery(ctx, message, promise));
        return toMono(promise);
    }

    /**
     * <p>
     * Execute from cache if the statement text has been prepared on this connection,
     * else prepare it first and execute when the prepare response finished.
     * <br/>
     * <p>
     * Only one prepare may be outstanding per connection.
     * <br/>
     *
     * @return completes when the first request (prepare or execute) is written
     */
    public Mono<Void> write(final PreparedStatementMessage message) {
        final ChannelHandlerContext ctx = this.writableContext();
        if (ctx == null) {
            return Mono.error(MySQLExceptions.sessionHaveClosed());
        }
        final ChannelPromise promise = ctx.newPromise();
        this.runInEventLoop(ctx, () -> this.writePreparedStatement(ctx, message, promise));
        return toMono(promise);
    }

    public Mono<Void> write(final HandshakeResponseMessage message) {
        return this.writeClientMessage(message);
    }

    public Mono<Void> write(final QuitMessage message) {
        return this.writeClientMessage(message);
    }


    /*################################## blow ChannelHandler method ##################################*/

    @Override
    public void handlerAdded(final ChannelHandlerContext ctx) {
        this.currentContext = ctx;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        LOG.debug("[{}] channel active", this.connectionId);
        this.state = ConnectionState.CONNECTED;
        this.delegate.connected(ctx);
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        LOG.debug("[{}] channel inactive", this.connectionId);
        this.state = ConnectionState.CLOSED;
        // server side statements died with the session
        this.preparedStatements.clear();

        final ExchangeState exchange = this.exchange;
        if (this.exchangeInFlight || exchange.phase() != ExchangeState.Phase.IDLE) {
            this.clearQueryState();
            this.handleException(MySQLExceptions.closedDuringExchange(this.connectionId, exchange.phase()));
        }
        this.failConnect(MySQLExceptions.closedBeforeHandshake(this.connectionId));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        this.handleException(MySQLExceptions.unwrap(cause));
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Object msg) {
        if (!(msg instanceof ServerMessage)) {
            throw new IllegalArgumentException(String.format("unexpected message type %s", msg.getClass().getName()));
        }
        final ServerMessage message = (ServerMessage) msg;
        if (LOG.isTraceEnabled()) {
            LOG.trace("[{}] message received {}", this.connectionId, message);
        }

        switch (message.kind()) {
            case HANDSHAKE:
                this.delegate.onHandshake((HandshakeMessage) message);
                break;
            case OK: {
                final OkMessage ok = (OkMessage) message;
                this.clearQueryState();
                SERVER_STATUS.set(this, ok.statusFags);
                this.delegate.onOk(ok);
            }
            break;
            case ERROR:
                this.clearQueryState();
                this.delegate.onError((ErrorMessage) message);
                break;
            case EOF: {
                final EofMessage eof = (EofMessage) message;
                final MutableResultSet resultSet = this.exchange.resultSet();
                this.clearQueryState();
                SERVER_STATUS.set(this, eof.statusFags);
                if (resultSet == null) {
                    this.delegate.onEOF(eof);
                } else {
                    this.delegate.onResultSet(resultSet, eof);
                }
            }
            break;
            case COLUMN_DEFINITION:
                this.exchange = this.exchange.onColumnDefinition((ColumnDefinitionMessage) message);
                break;
            case COLUMN_DEFINITION_FINISHED:
            case PARAM_AND_COLUMN_PROCESSING_FINISHED:
                this.onColumnDefinitionFinished(ctx);
                break;
            case PREPARE_RESPONSE:
                this.exchange = this.exchange.onPrepareResponse((PreparedStatementPrepareResponse) message);
                break;
            case ROW:
                this.onTextRow((ResultSetRowMessage) message);
                break;
            case BINARY_ROW:
                this.onBinaryRow((BinaryRowMessage) message);
                break;
            case PARAM_PROCESSING_FINISHED:
                // column definitions follow
                break;
            default:
                throw new IllegalArgumentException(String.format("unknown message kind %s", message.kind()));
        }

    }


    @Override
    public String toString() {
        return String.format("%s[ connectionId : %s , state : %s , exchange : %s ]", getClass().getSimpleName(),
                this.connectionId, this.state, this.exchange.phase());
    }

    /*################################## blow package method ##################################*/

    /**
     * for test
     */
    ExchangeState exchangeState() {
        return this.exchange;
    }

    /**
     * for test
     */
    PreparedStatementCache preparedStatements() {
        return this.preparedStatements;
    }


    /*################################## blow private method ##################################*/

    @Nullable
    private ChannelHandlerContext writableContext() {
        final ChannelHandlerContext ctx = this.currentContext;
        if (ctx == null || this.state == ConnectionState.CLOSED) {
            return null;
        }
        return ctx;
    }

    private void clearQueryState() {
        this.exchange = ExchangeState.idle();
        this.exchangeInFlight = false;
    }

    private void runInEventLoop(final ChannelHandlerContext ctx, final Runnable task) {
        final EventLoop eventLoop = ctx.channel().eventLoop();
        if (eventLoop.inEventLoop()) {
            task.run();
        } else {
            eventLoop.execute(task);
        }
    }

    /**
     * Must run in event loop.
     *
     * @see #write(QueryMessage)
     */
    private void writeQuery(final ChannelHandlerContext ctx, final QueryMessage message,
                            final ChannelPromise promise) {
        this.codec.queryProcessStarted();
        this.exchangeInFlight = true;
        this.writeAndHandleError(ctx, message, promise);
    }

    /**
     * @see #channelRead0(ChannelHandlerContext, Object)
     */
    private void onColumnDefinitionFinished(final ChannelHandlerContext ctx) {
        final ExchangeState state = this.exchange;
        final PreparedStatementHolder holder = state.holder();
        final PreparedStatementMessage request = state.preparingRequest();
        if (holder == null || request == null) {
            this.exchange = state.finishColumns();
            return;
        }
        if (holder.needsAny()) {
            LOG.warn("[{}] {} finished with pending definitions", this.connectionId, holder);
        }
        // 1. result set of the prepared columns
        this.exchange = ExchangeState.streaming(MutableResultSet.create(holder.columns()));
        // 2. cache
        this.preparedStatements.put(holder);
        LOG.debug("[{}] statement prepared and cached, cache size {}", this.connectionId,
                this.preparedStatements.size());
        // 3. deferred execute
        this.executePreparedStatement(ctx, holder, request.values(), ctx.newPromise());
    }

    private void onTextRow(final ResultSetRowMessage message) {
        final MutableResultSet resultSet = this.exchange.resultSet();
        if (resultSet == null) {
            throw MySQLExceptions.rowOutsideResultSet(message);
        }
        final int size = message.size();
        final Object[] values = new Object[size];

        ByteBuf value;
        ColumnDefinitionMessage column;
        for (int i = 0; i < size; i++) {
            value = message.get(i);
            if (value == null) {
                values[i] = null;
                continue;
            }
            column = resultSet.columnType(i);
            values[i] = this.textDecoders.forType(column.columnType).decode(column, value, this.charset);
        }
        resultSet.addRow(values);
    }

    private void onBinaryRow(final BinaryRowMessage message) {
        final ExchangeState state = this.exchange;
        final MutableResultSet resultSet = state.resultSet();
        if (resultSet == null) {
            throw MySQLExceptions.rowOutsideResultSet(message);
        }
        resultSet.addRow(this.binaryRowDecoder.decode(message.buffer(), state.columns()));
    }

    /**
     * Must run in event loop.
     *
     * @see #write(PreparedStatementMessage)
     */
    private void writePreparedStatement(final ChannelHandlerContext ctx, final PreparedStatementMessage message,
                                        final ChannelPromise promise) {
        final PreparedStatementHolder holder = this.preparedStatements.get(message.statement);
        if (holder == null) {
            this.exchange = ExchangeState.preparing(message);
            this.exchangeInFlight = true;
            this.codec.preparedStatementPrepareStarted();
            this.writeAndHandleError(ctx, PreparedStatementPrepareMessage.of(message.statement), promise);
        } else {
            this.clearQueryState();
            this.exchangeInFlight = true;
            this.executePreparedStatement(ctx, holder, message.values(), promise);
        }
    }

    private void executePreparedStatement(final ChannelHandlerContext ctx, final PreparedStatementHolder holder,
                                          final List<Object> values, final ChannelPromise promise) {
        final List<ColumnDefinitionMessage> parameters = holder.parameters();
        this.codec.preparedStatementExecuteStarted(holder.columns().size(), parameters.size());

        final PreparedStatementExecuteMessage message;
        try {
            message = PreparedStatementExecuteMessage.create(holder.statementId(), values, parameters);
        } catch (IllegalArgumentException e) {
            // nothing written, no response will come
            this.clearQueryState();
            promise.addListener(this.writeErrorListener);
            promise.setFailure(e);
            return;
        }
        LOG.debug("[{}] execute prepared statement {}", this.connectionId, holder.statement);
        this.writeAndHandleError(ctx, message, promise);
    }

    private Mono<Void> writeClientMessage(final ClientMessage message) {
        final ChannelHandlerContext ctx = this.writableContext();
        if (ctx == null) {
            return Mono.error(MySQLExceptions.sessionHaveClosed());
        }
        return toMono(this.writeAndHandleError(ctx, message, ctx.newPromise()));
    }

    private ChannelFuture writeAndHandleError(final ChannelHandlerContext ctx, final Object message,
                                              final ChannelPromise promise) {
        promise.addListener(this.writeErrorListener);
        return ctx.writeAndFlush(message, promise);
    }

    private void onWriteComplete(final ChannelFuture future) {
        final Throwable cause = future.cause();
        if (cause != null) {
            this.handleException(MySQLExceptions.unwrap(cause));
        }
    }

    private Mono<Void> toMono(final ChannelFuture future) {
        return Mono.<Void>create(sink -> future.addListener(f -> {
                    if (f.isSuccess()) {
                        sink.success();
                    } else {
                        sink.error(MySQLExceptions.unwrap(f.cause()));
                    }
                }))
                .publishOn(this.scheduler);
    }

    private void onConnectFailure(final Throwable cause) {
        LOG.debug("[{}] connect failure", this.connectionId, cause);
        this.state = ConnectionState.CLOSED;
        this.failConnect(MySQLExceptions.mapConnectionError(cause));
    }

    /**
     * <p>
     * Fail the connect outcome if it is still pending and always notify the delegate.
     * <br/>
     */
    private void handleException(final Throwable cause) {
        if (this.failConnect(cause)) {
            LOG.debug("[{}] connect outcome failed by exception", this.connectionId, cause);
        }
        this.delegate.exceptionCaught(cause);
    }

    /**
     * @return true : this invocation completed the outcome
     */
    private boolean failConnect(final Throwable cause) {
        if (!CONNECT_DONE.compareAndSet(this, 0, 1)) {
            return false;
        }
        final Sinks.EmitResult result = this.connectionSink.tryEmitError(cause);
        if (result.isFailure()) {
            LOG.warn("[{}] emit connect outcome failure, {}", this.connectionId, result);
        }
        return true;
    }


}
