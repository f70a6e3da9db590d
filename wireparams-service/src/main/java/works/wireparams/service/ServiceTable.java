package works.wireparams.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wireparams.Param;
import works.wireparams.codec.CodecSettings;
import works.wireparams.codec.ParamCodec;
import works.wireparams.codec.ParamCodecBuilder;
import works.wireparams.codec.Params;
import works.wireparams.exceptions.ParamDecodeException;
import works.wireparams.service.exceptions.DuplicateServiceException;
import works.wireparams.service.exceptions.ServiceNotFoundException;
import works.wireparams.service.exceptions.ServiceTableFrozenException;
import works.wireparams.service.exceptions.UnregisteredServicesException;
import works.wireparams.service.exceptions.UnregistrableServiceException;
import works.wireparams.shape.ParamFingerprint;

import static java.util.Objects.requireNonNull;
import static works.wireparams.service.Services.RESERVED_PREFIX;
import static works.wireparams.service.Services.STATE_PARAM;

/**
 * Maps incoming requests to the handler of the service that accepts them.
 * <p>
 * Several services may share a path. They are told apart by their state codes,
 * and then by whether their parameter shapes accept the request:
 * decoding is {@link CodecSettings#STRICT strict}, so a stray parameter
 * disqualifies a candidate.
 * <p>
 * Services are registered during initialisation, which ends with {@link #endInitialisation()}.
 * After that, the table is frozen and can be considered immutable,
 * so {@link #dispatch} may be called from any number of threads.
 * Registration itself is not thread-safe.
 *
 * @param <R> the response type returned by handlers
 */
public class ServiceTable<R> {
	private final ParamCodec codec;
	private final Map<List<String>, List<Registration<?, ?, R>>> byPath = new LinkedHashMap<>();
	private final Set<Service<?, ?>> declared = new LinkedHashSet<>();
	private final AtomicBoolean isFrozen = new AtomicBoolean(false);

	public ServiceTable() {
		this(ParamCodecBuilder.using(CodecSettings.STRICT).build());
	}

	public ServiceTable(ParamCodec codec) {
		this.codec = requireNonNull(codec);
	}

	record Registration<G, P, R>(Service<G, P> service, ServiceHandler<G, P, R> handler) {
		/**
		 * Two registrations with equal keys could never be told apart by a request.
		 */
		RegistrationKey key() {
			return new RegistrationKey(
				service.path(),
				service.kind(),
				service.state(),
				ParamFingerprint.describe(service.getParams()),
				ParamFingerprint.describe(service.postParams()));
		}

		/**
		 * @return the handler call, ready to go
		 * @throws ParamDecodeException if this service doesn't accept the parameters
		 */
		Supplier<R> bind(ParamCodec codec, RequestContext context, List<Param> getParams, List<Param> postParams) {
			G get = codec.reconstruct(service.getParams(), getParams, Map.of(), context.suffix());
			P post = codec.reconstruct(service.postParams(), postParams, context.request().files(), List.of());
			return () -> handler.handle(context, get, post);
		}
	}

	record RegistrationKey(List<String> path, ServiceKind kind, Optional<String> state, String getShape, String postShape) { }

	public <G, P> void register(Service<G, P> service, ServiceHandler<G, P, R> handler) {
		requireMutable();
		if (service.kind() == ServiceKind.EXTERNAL) {
			throw new UnregistrableServiceException("Can't register external service " + service);
		}
		var registration = new Registration<>(service, requireNonNull(handler));
		var key = registration.key();
		List<Registration<?, ?, R>> atPath = byPath.computeIfAbsent(service.path(), p -> new ArrayList<>());
		for (var existing : atPath) {
			if (existing.key().equals(key)) {
				throw new DuplicateServiceException("Service already registered: " + existing.service());
			}
		}
		atPath.add(registration);
		declared.remove(service);
		LOGGER.debug("Registered {}", service);
	}

	/**
	 * Records that {@code service} must be {@link #register registered}
	 * before {@link #endInitialisation()}.
	 * Useful when a service is created early so that other pages can link to it,
	 * but its handler is registered elsewhere.
	 */
	public void declare(Service<?, ?> service) {
		requireMutable();
		if (!isRegistered(service)) {
			declared.add(service);
		}
	}

	/**
	 * @throws UnregisteredServicesException if a {@link #declare declared} service hasn't been registered;
	 * the table is then left unfrozen
	 */
	public void endInitialisation() {
		requireMutable();
		if (!declared.isEmpty()) {
			List<String> names = new ArrayList<>();
			declared.forEach(s -> names.add(s.toString()));
			throw new UnregisteredServicesException(names);
		}
		isFrozen.set(true);
		LOGGER.info("Service table initialised with {} paths", byPath.size());
	}

	public boolean isFrozen() {
		return isFrozen.get();
	}

	public boolean isRegistered(Service<?, ?> service) {
		List<Registration<?, ?, R>> atPath = byPath.get(service.path());
		return atPath != null && atPath.stream().anyMatch(r -> r.service().equals(service));
	}

	/**
	 * Finds the service for {@code request} and calls its handler.
	 * <p>
	 * The longest registered path that prefixes the request path wins;
	 * a shorter path can only match if its service takes a URL suffix.
	 * Among the services at that path, an auxiliary service whose state code matches the request comes first,
	 * followed by the public ones in registration order. Auxiliary services with any other state code are skipped.
	 * The first candidate whose parameters decode gets to handle the request.
	 *
	 * @throws ServiceNotFoundException if no service is registered for the path
	 * @throws ParamDecodeException from the first candidate, if no candidate accepts the parameters
	 */
	public R dispatch(RawRequest request) {
		List<String> path = request.path();
		String state = stateOf(request);
		for (int length = path.size(); length >= 0; length--) {
			List<String> servicePath = path.subList(0, length);
			List<Registration<?, ?, R>> candidates = candidates(servicePath, length < path.size(), state);
			if (!candidates.isEmpty()) {
				LOGGER.debug("Request for {} matched {} candidates at {}", path, candidates.size(), servicePath);
				var context = new RequestContext(request, servicePath, path.subList(length, path.size()));
				return invokeFirstAccepting(candidates, context);
			}
		}
		throw new ServiceNotFoundException(path);
	}

	private List<Registration<?, ?, R>> candidates(List<String> servicePath, boolean hasSuffix, @Nullable String state) {
		List<Registration<?, ?, R>> atPath = byPath.get(servicePath);
		if (atPath == null) {
			return List.of();
		}
		List<Registration<?, ?, R>> auxiliary = new ArrayList<>();
		List<Registration<?, ?, R>> others = new ArrayList<>();
		for (var registration : atPath) {
			Service<?, ?> service = registration.service();
			if (hasSuffix && !service.takesSuffix()) {
				continue;
			}
			if (service.kind() == ServiceKind.AUXILIARY) {
				if (service.state().get().equals(state)) {
					auxiliary.add(registration);
				}
			} else {
				others.add(registration);
			}
		}
		auxiliary.addAll(others);
		return auxiliary;
	}

	private R invokeFirstAccepting(List<Registration<?, ?, R>> candidates, RequestContext context) {
		RawRequest request = context.request();
		List<Param> getParams = Params.removePrefixed(RESERVED_PREFIX, request.getParams());
		List<Param> postParams = Params.removePrefixed(RESERVED_PREFIX, request.postParams());
		ParamDecodeException firstFailure = null;
		for (var candidate : candidates) {
			Supplier<R> call;
			try {
				call = candidate.bind(codec, context, getParams, postParams);
			} catch (ParamDecodeException e) {
				LOGGER.debug("{} rejected the request: {}", candidate.service(), e.getMessage());
				if (firstFailure == null) {
					firstFailure = e;
				}
				continue;
			}
			return call.get();
		}
		throw requireNonNull(firstFailure);
	}

	private static @Nullable String stateOf(RawRequest request) {
		for (Param p : request.getParams()) {
			if (p.key().equals(STATE_PARAM)) {
				return p.value();
			}
		}
		for (Param p : request.postParams()) {
			if (p.key().equals(STATE_PARAM)) {
				return p.value();
			}
		}
		return null;
	}

	private void requireMutable() {
		if (isFrozen.get()) {
			throw new ServiceTableFrozenException("Service table initialisation has ended");
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ServiceTable.class);
}
