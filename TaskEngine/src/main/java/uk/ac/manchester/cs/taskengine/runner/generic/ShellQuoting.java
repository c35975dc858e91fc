package uk.ac.manchester.cs.taskengine.runner.generic;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Quoting of words for a POSIX shell.
 */
public abstract class ShellQuoting {
	private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

	private ShellQuoting() {
	}

	/**
	 * @param word
	 *            The word to protect.
	 * @return The word, quoted if the shell would otherwise split or expand it.
	 */
	public static String quote(String word) {
		if (SAFE.matcher(word).matches())
			return word;
		return "'" + word.replace("'", "'\\''") + "'";
	}

	/**
	 * @return The words, each quoted as needed, joined by spaces.
	 */
	public static String join(List<String> words) {
		StringBuilder sb = new StringBuilder();
		for (String word : words) {
			if (sb.length() > 0)
				sb.append(' ');
			sb.append(quote(word));
		}
		return sb.toString();
	}
}
