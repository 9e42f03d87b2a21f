package io.snapshotd.bus;

import io.snapshotd.TransportException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process {@link MessageBus} for embedding the daemon and for tests.
 *
 * <p>Method calls made through {@link #invoke} are handed to the exported handler on the
 * caller's thread; the returned future completes when the handler answers. Signals are
 * delivered synchronously, on the emitting thread, to every subscriber of the path.
 *
 * <p>This class is thread-safe. It is not final so tests can override {@link #emit} to
 * simulate transport failures.
 */
public class LocalMessageBus implements MessageBus {
    private static final Logger logger = Logger.getLogger(LocalMessageBus.class.getName());

    static final String UNKNOWN_METHOD = "org.freedesktop.DBus.Error.UnknownMethod";
    static final String FAILED = "org.freedesktop.DBus.Error.Failed";

    private final Map<String, ExportedObject> objects = new ConcurrentHashMap<>();
    private final List<Match> matches = new CopyOnWriteArrayList<>();
    private final Set<String> names = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    @Override
    public void requestName(String name) throws TransportException {
        Objects.requireNonNull(name, "name");
        checkOpen();
        names.add(name);
    }

    /**
     * Returns the names acquired through {@link #requestName}.
     *
     * @return owned names
     */
    public Set<String> ownedNames() {
        return Set.copyOf(names);
    }

    @Override
    public void export(String objectPath, String interfaceName, Map<String, MethodHandler> methods)
            throws TransportException {
        Objects.requireNonNull(objectPath, "objectPath");
        Objects.requireNonNull(interfaceName, "interfaceName");
        checkOpen();
        ExportedObject object = new ExportedObject(interfaceName, Map.copyOf(methods));
        if (objects.putIfAbsent(objectPath, object) != null) {
            throw new TransportException("An object is already exported at " + objectPath);
        }
    }

    /**
     * Calls a method on the first exported object that has it. Use {@link #invokeAt} when
     * several objects export the same method.
     *
     * @param member method name
     * @param args   call arguments
     * @return future completed with the reply values, or failed with {@link MethodErrorException}
     */
    public CompletableFuture<List<Object>> invoke(String member, Object... args) {
        for (Map.Entry<String, ExportedObject> entry : objects.entrySet()) {
            if (entry.getValue().methods().containsKey(member)) {
                return invokeAt(entry.getKey(), member, args);
            }
        }
        return CompletableFuture.failedFuture(
                new MethodErrorException(UNKNOWN_METHOD, "No such method: " + member));
    }

    /**
     * Calls a method on the object exported at {@code objectPath}.
     *
     * @param objectPath object path
     * @param member     method name
     * @param args       call arguments
     * @return future completed with the reply values, or failed with {@link MethodErrorException}
     */
    public CompletableFuture<List<Object>> invokeAt(String objectPath, String member, Object... args) {
        CompletableFuture<List<Object>> reply = new CompletableFuture<>();
        if (closed) {
            reply.completeExceptionally(new MethodErrorException(FAILED, "Bus is closed"));
            return reply;
        }
        ExportedObject object = objects.get(objectPath);
        MethodHandler handler = object == null ? null : object.methods().get(member);
        if (handler == null) {
            reply.completeExceptionally(new MethodErrorException(UNKNOWN_METHOD,
                    "No such method " + member + " at " + objectPath));
            return reply;
        }
        LocalMethodCall call = new LocalMethodCall(member, List.of(args), reply);
        try {
            handler.handle(call);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Handler for " + member + " failed", e);
            if (call.answered.compareAndSet(false, true)) {
                reply.completeExceptionally(new MethodErrorException(FAILED, String.valueOf(e.getMessage())));
            }
        }
        return reply;
    }

    @Override
    public void emit(String objectPath, String interfaceName, BusSignal signal) throws TransportException {
        Objects.requireNonNull(signal, "signal");
        checkOpen();
        for (Match match : matches) {
            if (!match.objectPath().equals(objectPath)) {
                continue;
            }
            try {
                match.listener().onSignal(interfaceName, signal);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Signal listener failed for " + signal.member(), e);
            }
        }
    }

    @Override
    public Subscription subscribe(String objectPath, SignalListener listener) throws TransportException {
        Objects.requireNonNull(objectPath, "objectPath");
        Objects.requireNonNull(listener, "listener");
        checkOpen();
        Match match = new Match(objectPath, listener);
        matches.add(match);
        return () -> matches.remove(match);
    }

    @Override
    public void close() {
        closed = true;
        matches.clear();
        objects.clear();
        names.clear();
    }

    private void checkOpen() throws TransportException {
        if (closed) {
            throw new TransportException("Bus is closed");
        }
    }

    private record ExportedObject(String interfaceName, Map<String, MethodHandler> methods) {
    }

    private record Match(String objectPath, SignalListener listener) {
    }

    private static final class LocalMethodCall implements MethodCall {
        private final String member;
        private final List<Object> arguments;
        private final CompletableFuture<List<Object>> reply;
        private final AtomicBoolean answered = new AtomicBoolean();

        LocalMethodCall(String member, List<Object> arguments, CompletableFuture<List<Object>> reply) {
            this.member = member;
            this.arguments = arguments;
            this.reply = reply;
        }

        @Override
        public String member() {
            return member;
        }

        @Override
        public List<Object> arguments() {
            return arguments;
        }

        @Override
        public void reply(Object... values) {
            markAnswered();
            reply.complete(List.of(values));
        }

        @Override
        public void replyError(String errorName, String message) {
            markAnswered();
            reply.completeExceptionally(new MethodErrorException(errorName, message));
        }

        private void markAnswered() {
            if (!answered.compareAndSet(false, true)) {
                throw new IllegalStateException("Call to " + member + " was already answered");
            }
        }
    }
}
