package my.architrack.app.statement;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Byte-wise ordering of row text: UTF-8 bytes compared unsigned, empty value first.
 */
final class TextOrder {
	private TextOrder() {
	}

	static int compare(String a, String b) {
		String left = GroupKey.normalize(a);
		String right = GroupKey.normalize(b);
		if (left.equals(right)) {
			return 0;
		}
		return Arrays.compareUnsigned(left.getBytes(StandardCharsets.UTF_8), right.getBytes(StandardCharsets.UTF_8));
	}
}
