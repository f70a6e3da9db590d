package works.wireparams.codec.interpreter;

import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import works.wireparams.FileInfo;
import works.wireparams.Param;

/**
 * The parts of a request that no shape node has claimed yet.
 * <p>
 * Immutable: claiming something yields a new {@code Remaining},
 * so a node that backs out of a decode just carries on with the one it was given.
 */
record Remaining(
	PVector<Param> params,
	PMap<String, PVector<FileInfo>> files,
	PVector<String> suffix
) {
	static Remaining of(List<Param> params, Map<String, List<FileInfo>> files, List<String> suffix) {
		PMap<String, PVector<FileInfo>> fileMap = HashTreePMap.empty();
		for (var entry : files.entrySet()) {
			if (!entry.getValue().isEmpty()) {
				fileMap = fileMap.plus(entry.getKey(), TreePVector.from(entry.getValue()));
			}
		}
		return new Remaining(TreePVector.from(params), fileMap, TreePVector.from(suffix));
	}

	/**
	 * @return the position of the first pair with the given key, or -1
	 */
	int indexOf(String key) {
		for (int i = 0; i < params.size(); i++) {
			if (params.get(i).key().equals(key)) {
				return i;
			}
		}
		return -1;
	}

	boolean hasParam(String key) {
		return indexOf(key) >= 0;
	}

	Remaining withoutParam(int index) {
		return new Remaining(params.minus(index), files, suffix);
	}

	Remaining withoutParams() {
		return new Remaining(TreePVector.empty(), files, suffix);
	}

	@Nullable FileInfo firstFile(String key) {
		PVector<FileInfo> entries = files.get(key);
		return (entries == null)? null : entries.get(0);
	}

	Remaining withoutFirstFile(String key) {
		PVector<FileInfo> entries = files.get(key);
		if (entries.size() == 1) {
			return new Remaining(params, files.minus(key), suffix);
		} else {
			return new Remaining(params, files.plus(key, entries.minus(0)), suffix);
		}
	}

	@Nullable String firstSegment() {
		return suffix.isEmpty()? null : suffix.get(0);
	}

	Remaining withoutSegments(int count) {
		return new Remaining(params, files, suffix.subList(count, suffix.size()));
	}
}
