package works.wireparams.codec.interpreter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.wireparams.BinSum;
import works.wireparams.Coordinates;
import works.wireparams.FileInfo;
import works.wireparams.Pair;
import works.wireparams.Param;
import works.wireparams.Unit;
import works.wireparams.codec.CodecSettings;
import works.wireparams.codec.NameGenerator;
import works.wireparams.codec.ParamDecoder;
import works.wireparams.exceptions.AmbiguousSumException;
import works.wireparams.exceptions.FileFieldException;
import works.wireparams.exceptions.InvalidParameterValueException;
import works.wireparams.exceptions.MissingParameterException;
import works.wireparams.exceptions.ParamDecodeException;
import works.wireparams.exceptions.RegexpMismatchException;
import works.wireparams.exceptions.UnexpectedParameterException;
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
import works.wireparams.shape.LeafNode;
import works.wireparams.shape.ListNode;
import works.wireparams.shape.OptionNode;
import works.wireparams.shape.ParamType;
import works.wireparams.shape.PrefixedNode;
import works.wireparams.shape.ProductNode;
import works.wireparams.shape.RegexpNode;
import works.wireparams.shape.ScalarKind;
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
 * Decodes request parameters by walking the {@link ParamType} tree.
 * <p>
 * Each node claims the pairs, files and path segments it recognizes,
 * and passes on what's left, so sibling nodes never see each other's parameters.
 * Where several pairs share a key, a single-valued node claims the first.
 */
public class ShapeInterpretingDecoder<T> implements ParamDecoder<T> {
	private final ParamType<T> type;
	private final CodecSettings settings;

	public ShapeInterpretingDecoder(ParamType<T> type, CodecSettings settings) {
		this.type = requireNonNull(type);
		this.settings = requireNonNull(settings);
	}

	@Override
	@SuppressWarnings("unchecked")
	public T reconstruct(List<Param> params, Map<String, List<FileInfo>> files, List<String> suffix) throws ParamDecodeException {
		LOGGER.debug("Reconstructing {} from {} params, {} files, suffix {}", type, params.size(), files.size(), suffix);
		Decoded result = decodeAny(type, Remaining.of(params, files, suffix), NameGenerator.root());
		checkLeftovers(result.rest());
		return (T) result.value();
	}

	private void checkLeftovers(Remaining rest) {
		if (type.containsSuffix() && !rest.suffix().isEmpty() && settings.isRejectExtraSuffixSegments()) {
			throw new InvalidParameterValueException(SUFFIX, String.join("/", rest.suffix()));
		}
		if (rest.params().isEmpty() && rest.files().isEmpty()) {
			return;
		}
		Set<String> unused = new LinkedHashSet<>();
		rest.params().forEach(p -> unused.add(p.key()));
		unused.addAll(new TreeSet<>(rest.files().keySet()));
		if (settings.isRejectUnusedParameters()) {
			throw new UnexpectedParameterException(List.copyOf(unused));
		} else {
			LOGGER.warn("Ignoring unused parameters {}", unused);
		}
	}

	record Decoded(Object value, Remaining rest) { }

	static Decoded decodeAny(ParamType<?> node, Remaining in, NameGenerator names) {
		if (node instanceof ScalarNode<?> n) {
			return decodeString(names.key(n.name()), n.kind(), in);
		} else if (node instanceof UserTypeNode<?> n) {
			return decodeString(names.key(n.name()), n.codec(), in);
		} else if (node instanceof BoolNode n) {
			int index = in.indexOf(names.key(n.name()));
			if (index < 0) {
				return new Decoded(false, in);
			} else {
				return new Decoded(true, in.withoutParam(index));
			}
		} else if (node instanceof FileNode n) {
			return decodeFile(names.key(n.name()), in);
		} else if (node instanceof RegexpNode n) {
			String key = names.key(n.name());
			int index = requiredIndex(key, in);
			String raw = in.params().get(index).value();
			return new Decoded(match(key, raw, n.pattern(), n.template()), in.withoutParam(index));
		} else if (node instanceof CoordinatesNode n) {
			return decodeCoordinates(names.key(n.name()), in);
		} else if (node instanceof ValuedCoordinatesNode<?> n) {
			String key = names.key(n.name());
			Decoded coordinates = decodeCoordinates(key, in);
			Decoded companion = decodeString(key, n.companion(), coordinates.rest());
			return new Decoded(Pair.of(companion.value(), coordinates.value()), companion.rest());
		} else if (node instanceof ProductNode<?, ?> n) {
			Decoded left = decodeAny(n.left(), in, names);
			Decoded right = decodeAny(n.right(), left.rest(), names.skip(n.left().sumCount()));
			return new Decoded(Pair.of(left.value(), right.value()), right.rest());
		} else if (node instanceof SumNode<?> n) {
			return decodeSum(n, in, names);
		} else if (node instanceof OptionNode<?> n) {
			return decodeOption(n, in, names);
		} else if (node instanceof SetNode<?> n) {
			return decodeSet(n, in, names);
		} else if (node instanceof ListNode<?> n) {
			return decodeList(n, in, names);
		} else if (node instanceof SuffixNode<?> n) {
			return decodeSegments(n.inner(), in, names);
		} else if (node instanceof AllSuffixSpec<?> n) {
			return decodeAllSuffix(n, in, names);
		} else if (node instanceof AnyNode) {
			return new Decoded(List.copyOf(in.params()), in.withoutParams());
		} else if (node instanceof UnitNode) {
			return new Decoded(Unit.UNIT, in);
		} else if (node instanceof PrefixedNode<?> n) {
			return decodeAny(n.inner(), in, names.prefixed(n.prefix()));
		} else {
			throw new AssertionError("Unexpected parameter shape: " + node);
		}
	}

	private static Decoded decodeString(String key, StringCodec<?> codec, Remaining in) {
		int index = requiredIndex(key, in);
		String raw = in.params().get(index).value();
		return new Decoded(parse(key, raw, codec), in.withoutParam(index));
	}

	private static Decoded decodeCoordinates(String key, Remaining in) {
		Decoded x = decodeString(abscissaKey(key), ScalarKind.INT, in);
		Decoded y = decodeString(ordinateKey(key), ScalarKind.INT, x.rest());
		return new Decoded(new Coordinates((Integer) x.value(), (Integer) y.value()), y.rest());
	}

	private static Decoded decodeFile(String key, Remaining in) {
		FileInfo file = in.firstFile(key);
		if (file == null) {
			if (in.hasParam(key)) {
				throw new FileFieldException(key, "sent as a plain value, not a file upload");
			}
			throw new MissingParameterException(key);
		}
		if (file.filesize() < 0) {
			throw new FileFieldException(key, "negative size " + file.filesize());
		} else if (file.tmpFilename().isEmpty()) {
			throw new FileFieldException(key, "upload has no stored file");
		}
		return new Decoded(file, in.withoutFirstFile(key));
	}

	private static Decoded decodeSum(SumNode<?> node, Remaining in, NameGenerator names) {
		String discriminator = names.sumDiscriminator();
		int index = in.indexOf(discriminator);
		if (index < 0) {
			throw new AmbiguousSumException(discriminator, null);
		}
		String raw = in.params().get(index).value();
		Remaining rest = in.withoutParam(index);
		// Only the chosen side is read, whatever else happens to be present
		switch (raw) {
			case FIRST_ALTERNATIVE: {
				Decoded side = decodeAny(node.left(), rest, names.skip(1));
				return new Decoded(BinSum.inj1(side.value()), side.rest());
			}
			case SECOND_ALTERNATIVE: {
				Decoded side = decodeAny(node.right(), rest, names.skip(1 + node.left().sumCount()));
				return new Decoded(BinSum.inj2(side.value()), side.rest());
			}
			default:
				throw new AmbiguousSumException(discriminator, raw);
		}
	}

	private static Decoded decodeOption(OptionNode<?> node, Remaining in, NameGenerator names) {
		try {
			Decoded inner = decodeAny(node.inner(), in, names);
			return new Decoded(Optional.of(inner.value()), inner.rest());
		} catch (MissingParameterException e) {
			if (ownKeys(node.inner(), names).contains(e.paramName())) {
				LOGGER.debug("Optional parameter {} is absent", e.paramName());
				return new Decoded(Optional.empty(), in);
			}
			throw e;
		}
	}

	private static Decoded decodeSet(SetNode<?> node, Remaining in, NameGenerator names) {
		List<Object> values = new ArrayList<>();
		Remaining rest = in;
		while (isPresent(node.element(), rest, names)) {
			// Every leaf claims at least one entry, so this terminates
			Decoded element = decodeAny(node.element(), rest, names);
			values.add(element.value());
			rest = element.rest();
		}
		return new Decoded(List.copyOf(values), rest);
	}

	private static Decoded decodeList(ListNode<?> node, Remaining in, NameGenerator names) {
		String prefix = names.listPrefix(node.name());
		SortedSet<Integer> indices = new TreeSet<>();
		in.params().forEach(p -> addIndex(prefix, p.key(), indices));
		in.files().keySet().forEach(k -> addIndex(prefix, k, indices));
		LOGGER.debug("List {} has elements {}", prefix, indices);

		List<Object> values = new ArrayList<>();
		Remaining rest = in;
		for (int i : indices) {
			Decoded element = decodeAny(node.element(), rest, names.listElement(node.name(), i));
			values.add(element.value());
			rest = element.rest();
		}
		return new Decoded(List.copyOf(values), rest);
	}

	/**
	 * Only canonical decimal indices count; {@code l.01.a} is not element 1.
	 */
	private static void addIndex(String prefix, String key, Set<Integer> indices) {
		if (!key.startsWith(prefix)) {
			return;
		}
		int dot = key.indexOf('.', prefix.length());
		if (dot < 0) {
			return;
		}
		String candidate = key.substring(prefix.length(), dot);
		if (candidate.isEmpty() || candidate.length() > 9) {
			return;
		}
		for (int i = 0; i < candidate.length(); i++) {
			char c = candidate.charAt(i);
			if (c < '0' || c > '9') {
				return;
			}
		}
		int index = Integer.parseInt(candidate);
		if (Integer.toString(index).equals(candidate)) {
			indices.add(index);
		}
	}

	/**
	 * Positional decoding of the components of a {@link SuffixNode}.
	 */
	private static Decoded decodeSegments(ParamType<?> node, Remaining in, NameGenerator names) {
		if (node instanceof ScalarNode<?> n) {
			return decodeSegment(names.key(n.name()), n.kind(), in);
		} else if (node instanceof UserTypeNode<?> n) {
			return decodeSegment(names.key(n.name()), n.codec(), in);
		} else if (node instanceof RegexpNode n) {
			String key = names.key(n.name());
			String raw = requiredSegment(key, in);
			return new Decoded(match(key, raw, n.pattern(), n.template()), in.withoutSegments(1));
		} else if (node instanceof ProductNode<?, ?> n) {
			Decoded left = decodeSegments(n.left(), in, names);
			Decoded right = decodeSegments(n.right(), left.rest(), names);
			return new Decoded(Pair.of(left.value(), right.value()), right.rest());
		} else if (node instanceof AllSuffixSpec<?> n) {
			return decodeAllSuffix(n, in, names);
		} else if (node instanceof UnitNode) {
			return new Decoded(Unit.UNIT, in);
		} else {
			throw new AssertionError("Unexpected suffix component: " + node);
		}
	}

	private static Decoded decodeSegment(String key, StringCodec<?> codec, Remaining in) {
		String raw = requiredSegment(key, in);
		return new Decoded(parse(key, raw, codec), in.withoutSegments(1));
	}

	private static Decoded decodeAllSuffix(AllSuffixSpec<?> node, Remaining in, NameGenerator names) {
		String key = names.key(node.name());
		Remaining rest = in.withoutSegments(in.suffix().size());
		if (node instanceof AllSuffixNode) {
			return new Decoded(List.copyOf(in.suffix()), rest);
		}
		String joined = String.join("/", in.suffix());
		if (node instanceof AllSuffixStringNode) {
			return new Decoded(joined, rest);
		} else if (node instanceof AllSuffixUserNode<?> n) {
			return new Decoded(parse(key, joined, n.codec()), rest);
		} else if (node instanceof AllSuffixRegexpNode n) {
			return new Decoded(match(key, joined, n.pattern(), n.template()), rest);
		} else {
			throw new AssertionError("Unexpected suffix shape: " + node);
		}
	}

	private static int requiredIndex(String key, Remaining in) {
		int index = in.indexOf(key);
		if (index < 0) {
			throw new MissingParameterException(key);
		}
		return index;
	}

	private static String requiredSegment(String key, Remaining in) {
		String segment = in.firstSegment();
		if (segment == null) {
			throw new MissingParameterException(key);
		}
		return segment;
	}

	private static Object parse(String key, String raw, StringCodec<?> codec) {
		try {
			return requireNonNull(codec.parse(raw));
		} catch (RuntimeException e) {
			throw new InvalidParameterValueException(key, raw, e);
		}
	}

	private static String match(String key, String raw, CompiledPattern pattern, String template) {
		return pattern.rewrite(raw, template)
			.orElseThrow(() -> new RegexpMismatchException(key, raw, pattern.source()));
	}

	private static Set<String> ownKeys(LeafNode<?> leaf, NameGenerator names) {
		Set<String> result = new LinkedHashSet<>();
		leaf.keys().forEach(k -> result.add(names.key(k)));
		return result;
	}

	private static boolean isPresent(LeafNode<?> leaf, Remaining in, NameGenerator names) {
		for (String key : ownKeys(leaf, names)) {
			if (in.hasParam(key) || in.firstFile(key) != null) {
				return true;
			}
		}
		return false;
	}

	private static final String SUFFIX = "suffix";
	private static final Logger LOGGER = LoggerFactory.getLogger(ShapeInterpretingDecoder.class);
}
