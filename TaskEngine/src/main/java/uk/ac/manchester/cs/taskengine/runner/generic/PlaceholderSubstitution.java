package uk.ac.manchester.cs.taskengine.runner.generic;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills in <tt>~{name}</tt> and <tt>~{name:-default}</tt> placeholders in a
 * command template. A placeholder with no value and no default is left as
 * written. Runs of whitespace in the result are collapsed to one space.
 */
public abstract class PlaceholderSubstitution {
	private static final Pattern PLACEHOLDER = Pattern
			.compile("~\\{([^}:]+)(:-([^}]*))?\\}");
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private PlaceholderSubstitution() {
	}

	/**
	 * @param template
	 *            The command template.
	 * @param values
	 *            Placeholder values by name.
	 * @return The command.
	 */
	public static String substitute(String template, Map<String, String> values) {
		Matcher m = PLACEHOLDER.matcher(template);
		StringBuffer sb = new StringBuffer();
		while (m.find()) {
			String value = values.get(m.group(1));
			if (value == null)
				value = m.group(3);
			if (value == null)
				value = m.group();
			m.appendReplacement(sb, Matcher.quoteReplacement(value));
		}
		m.appendTail(sb);
		return WHITESPACE.matcher(sb).replaceAll(" ").trim();
	}
}
