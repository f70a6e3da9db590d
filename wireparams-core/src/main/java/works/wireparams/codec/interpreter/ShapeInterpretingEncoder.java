package works.wireparams.codec.interpreter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wireparams.BinSum;
import works.wireparams.Coordinates;
import works.wireparams.Pair;
import works.wireparams.Param;
import works.wireparams.codec.Construction;
import works.wireparams.codec.NameGenerator;
import works.wireparams.codec.ParamEncoder;
import works.wireparams.regex.CompiledPattern;
import works.wireparams.shape.AllSuffixNode;
import works.wireparams.shape.AllSuffixRegexpNode;
import works.wireparams.shape.AllSuffixSpec;
import works.wireparams.shape.AllSuffixStringNode;
import works.wireparams.shape.AllSuffixUserNode;
import works.wireparams.shape.AnyNode;
import works.wireparams.shape.BoolNode;
import works.wireparams.shape.CoordinatesNode;
import works.wireparams.shape.FileNode;
import works.wireparams.shape.ListNode;
import works.wireparams.shape.OptionNode;
import works.wireparams.shape.ParamType;
import works.wireparams.shape.PrefixedNode;
import works.wireparams.shape.ProductNode;
import works.wireparams.shape.RegexpNode;
import works.wireparams.shape.ScalarNode;
import works.wireparams.shape.SetNode;
import works.wireparams.shape.StringCodec;
import works.wireparams.shape.SuffixNode;
import works.wireparams.shape.SumNode;
import works.wireparams.shape.UnitNode;
import works.wireparams.shape.UserTypeNode;
import works.wireparams.shape.ValuedCoordinatesNode;

import static java.util.Objects.requireNonNull;
import static works.wireparams.codec.NameGenerator.FIRST_ALTERNATIVE;
import static works.wireparams.codec.NameGenerator.SECOND_ALTERNATIVE;
import static works.wireparams.shape.CoordinatesNode.abscissaKey;
import static works.wireparams.shape.CoordinatesNode.ordinateKey;

/**
 * Encodes values by walking the {@link ParamType} tree in lock-step with the value.
 */
public class ShapeInterpretingEncoder<T> implements ParamEncoder<T> {
	private final ParamType<T> type;

	public ShapeInterpretingEncoder(ParamType<T> type) {
		this.type = requireNonNull(type);
	}

	@Override
	public Construction construct(T value) {
		LOGGER.debug("Constructing parameters for {} using {}", (value == null)? "null" : value.getClass(), type);
		Session session = new Session();
		session.encodeAny(type, value, NameGenerator.root());
		Optional<List<String>> suffix = type.containsSuffix()
			? Optional.of(session.segments)
			: Optional.empty();
		return new Construction(suffix, session.params);
	}

	static final class Session {
		final List<Param> params = new ArrayList<>();
		final List<String> segments = new ArrayList<>();

		void encodeAny(ParamType<?> node, Object value, NameGenerator names) {
			if (node instanceof ScalarNode<?> n) {
				emit(names.key(n.name()), print(n.kind(), value));
			} else if (node instanceof UserTypeNode<?> n) {
				emit(names.key(n.name()), print(n.codec(), value));
			} else if (node instanceof BoolNode n) {
				if ((Boolean) value) {
					emit(names.key(n.name()), BoolNode.CHECKED);
				}
			} else if (node instanceof FileNode n) {
				throw new IllegalArgumentException("Can't put file parameter \"" + names.key(n.name()) + "\" in a URL");
			} else if (node instanceof RegexpNode n) {
				emit(names.key(n.name()), rewrite(n.pattern(), n.template(), (String) value));
			} else if (node instanceof CoordinatesNode n) {
				emitCoordinates(names.key(n.name()), (Coordinates) value);
			} else if (node instanceof ValuedCoordinatesNode<?> n) {
				Pair<?, ?> pair = (Pair<?, ?>) value;
				String key = names.key(n.name());
				emitCoordinates(key, (Coordinates) pair.right());
				emit(key, print(n.companion(), pair.left()));
			} else if (node instanceof ProductNode<?, ?> n) {
				Pair<?, ?> pair = (Pair<?, ?>) value;
				encodeAny(n.left(), pair.left(), names);
				encodeAny(n.right(), pair.right(), names.skip(n.left().sumCount()));
			} else if (node instanceof SumNode<?> n) {
				encodeSum(n, (BinSum<?, ?>) value, names);
			} else if (node instanceof OptionNode<?> n) {
				((Optional<?>) value).ifPresent(v -> encodeAny(n.inner(), v, names));
			} else if (node instanceof SetNode<?> n) {
				for (Object element : (List<?>) value) {
					encodeAny(n.element(), element, names);
				}
			} else if (node instanceof ListNode<?> n) {
				List<?> elements = (List<?>) value;
				for (int i = 0; i < elements.size(); i++) {
					encodeAny(n.element(), elements.get(i), names.listElement(n.name(), i));
				}
			} else if (node instanceof SuffixNode<?> n) {
				encodeSegments(n.inner(), value);
			} else if (node instanceof AllSuffixSpec<?> n) {
				encodeAllSuffix(n, value);
			} else if (node instanceof AnyNode) {
				for (Object p : (List<?>) value) {
					params.add((Param) p);
				}
			} else if (node instanceof UnitNode) {
				// Nothing to send
			} else if (node instanceof PrefixedNode<?> n) {
				encodeAny(n.inner(), value, names.prefixed(n.prefix()));
			} else {
				throw new AssertionError("Unexpected parameter shape: " + node);
			}
		}

		private void encodeSum(SumNode<?> node, BinSum<?, ?> value, NameGenerator names) {
			if (value instanceof BinSum.Inj1<?, ?> inj1) {
				emit(names.sumDiscriminator(), FIRST_ALTERNATIVE);
				encodeAny(node.left(), inj1.value(), names.skip(1));
			} else {
				emit(names.sumDiscriminator(), SECOND_ALTERNATIVE);
				encodeAny(node.right(), ((BinSum.Inj2<?, ?>) value).value(), names.skip(1 + node.left().sumCount()));
			}
		}

		/**
		 * Positional encoding of the components of a {@link SuffixNode}.
		 */
		private void encodeSegments(ParamType<?> node, Object value) {
			if (node instanceof ScalarNode<?> n) {
				segments.add(print(n.kind(), value));
			} else if (node instanceof UserTypeNode<?> n) {
				segments.add(print(n.codec(), value));
			} else if (node instanceof RegexpNode n) {
				segments.add(rewrite(n.pattern(), n.template(), (String) value));
			} else if (node instanceof ProductNode<?, ?> n) {
				Pair<?, ?> pair = (Pair<?, ?>) value;
				encodeSegments(n.left(), pair.left());
				encodeSegments(n.right(), pair.right());
			} else if (node instanceof AllSuffixSpec<?> n) {
				encodeAllSuffix(n, value);
			} else if (!(node instanceof UnitNode)) {
				throw new AssertionError("Unexpected suffix component: " + node);
			}
		}

		private void encodeAllSuffix(AllSuffixSpec<?> node, Object value) {
			if (node instanceof AllSuffixNode) {
				for (Object segment : (List<?>) value) {
					segments.add((String) segment);
				}
			} else if (node instanceof AllSuffixStringNode) {
				addPath((String) value);
			} else if (node instanceof AllSuffixUserNode<?> n) {
				addPath(print(n.codec(), value));
			} else if (node instanceof AllSuffixRegexpNode n) {
				addPath(rewrite(n.pattern(), n.template(), (String) value));
			} else {
				throw new AssertionError("Unexpected suffix shape: " + node);
			}
		}

		private void addPath(String path) {
			segments.addAll(Arrays.asList(path.split("/", -1)));
		}

		private void emitCoordinates(String key, Coordinates c) {
			emit(abscissaKey(key), Integer.toString(c.abscissa()));
			emit(ordinateKey(key), Integer.toString(c.ordinate()));
		}

		private void emit(String key, String value) {
			params.add(new Param(key, value));
		}

		/**
		 * A value that matches is sent in its rewritten form;
		 * anything else is sent as-is.
		 */
		private static String rewrite(CompiledPattern pattern, String template, String value) {
			return pattern.rewrite(value, template).orElse(value);
		}

		@SuppressWarnings("unchecked")
		private static <V> String print(StringCodec<V> codec, Object value) {
			return codec.print((V) value);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ShapeInterpretingEncoder.class);
}
