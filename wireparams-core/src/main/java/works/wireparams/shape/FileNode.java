package works.wireparams.shape;

import works.wireparams.FileInfo;

import static works.wireparams.shape.ShapeChecks.requireName;

/**
 * An uploaded file. Read from the request's file entries rather than its string pairs,
 * and so can't be encoded into a URL.
 */
public record FileNode(String name) implements LeafNode<FileInfo> {
	public FileNode {
		requireName(name, "Parameter");
	}

	@Override
	public String toString() {
		return "file(" + name + ")";
	}
}
