package org.lokray.astkit.error;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Describes one error: its code, a short description, the message template and the exception type it
 * produces. Templates use {@code {name}} placeholders.
 */
public class ErrorDescriptor
{
	private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

	@FunctionalInterface
	public interface ExceptionFactory
	{
		CodedException create(String message, ErrorCode code, Throwable cause);
	}

	private final ErrorCode code;
	private final String brief;
	private final String template;
	private final ExceptionFactory exceptionFactory;
	private BiConsumer<ErrorDescriptor, Map<String, ?>> debugCallback;

	public ErrorDescriptor(ErrorCode code, String brief, String template, ExceptionFactory exceptionFactory)
	{
		this.code = Objects.requireNonNull(code, "code");
		this.brief = brief;
		this.template = Objects.requireNonNull(template, "template");
		this.exceptionFactory = Objects.requireNonNull(exceptionFactory, "exceptionFactory");
	}

	public ErrorCode getCode()
	{
		return code;
	}

	public String getBrief()
	{
		return brief;
	}

	public String getTemplate()
	{
		return template;
	}

	public ExceptionFactory getExceptionFactory()
	{
		return exceptionFactory;
	}

	public BiConsumer<ErrorDescriptor, Map<String, ?>> getDebugCallback()
	{
		return debugCallback;
	}

	/**
	 * Callback invoked with the raw message values each time the registry renders this error.
	 */
	public void setDebugCallback(BiConsumer<ErrorDescriptor, Map<String, ?>> debugCallback)
	{
		this.debugCallback = debugCallback;
	}

	/**
	 * @throws IllegalArgumentException if the template names a value that is not given
	 */
	public String getMessage(Map<String, ?> values)
	{
		Matcher matcher = PLACEHOLDER.matcher(template);
		StringBuilder sb = new StringBuilder();
		while (matcher.find())
		{
			String name = matcher.group(1);
			if (!values.containsKey(name))
			{
				throw new IllegalArgumentException("no value for '" + name + "' in message of error " + code.code());
			}
			matcher.appendReplacement(sb, Matcher.quoteReplacement(String.valueOf(values.get(name))));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	public CodedException getException(Map<String, ?> values)
	{
		return exceptionFactory.create(getMessage(values), code, null);
	}
}
