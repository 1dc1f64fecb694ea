package org.lokray.scale.decl;

import org.lokray.scale.ast.Block;
import org.lokray.scale.ast.Fragment;
import org.lokray.scale.codegen.Detokenizer;
import org.lokray.scale.util.Tokens;

import java.util.List;
import java.util.Optional;

/**
 * One declaration of the form {@code name[, name...] = expr [from context] [: body]}.
 *
 * @param names      The declared names, in order.
 * @param expression The fragments right of {@code =}.
 * @param context    The fragments after {@code from}, if present.
 * @param body       The indented block under the declaration; empty if none.
 */
public record Declaration(List<String> names, List<Fragment> expression,
						  Optional<List<Fragment>> context, Block body)
{
	public Declaration
	{
		names = List.copyOf(names);
		expression = List.copyOf(expression);
		context = context.map(List::copyOf);
	}

	/**
	 * The expression as it was written in the source.
	 */
	public String expressionSource()
	{
		return new Detokenizer().detokenize(Tokens.flatten(expression));
	}

	/**
	 * The context expression as it was written, if any.
	 */
	public Optional<String> contextSource()
	{
		return context.map(c -> new Detokenizer().detokenize(Tokens.flatten(c)));
	}
}
