package works.wireparams;

import static java.util.Objects.requireNonNull;

/**
 * Metadata of an uploaded file, as supplied by the HTTP layer.
 *
 * @param tmpFilename where the server stored the upload
 * @param filesize in bytes
 * @param rawOriginalBasename the file name exactly as sent by the client
 * @param originalBasename the file name with any client-side directory stripped
 */
public record FileInfo(
	String tmpFilename,
	long filesize,
	String rawOriginalBasename,
	String originalBasename
) {
	public FileInfo {
		requireNonNull(tmpFilename);
		requireNonNull(rawOriginalBasename);
		requireNonNull(originalBasename);
	}
}
