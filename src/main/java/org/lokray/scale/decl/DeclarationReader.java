package org.lokray.scale.decl;

import org.lokray.scale.ast.Block;
import org.lokray.scale.ast.Fragment;
import org.lokray.scale.lexer.Token;
import org.lokray.scale.lexer.TokenError;
import org.lokray.scale.lexer.TokenType;
import org.lokray.scale.util.Partition;
import org.lokray.scale.util.Separator;
import org.lokray.scale.util.Tokens;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Reads a block of declarations:
 * <pre>
 * name = expression
 * first, second = expression from context
 * name = expression:
 *     nested block
 * </pre>
 * Built only from the public primitives: the block tree, whitespace stripping
 * and partitioning. Brackets are subexpressions, so an {@code =}, {@code :} or
 * {@code from} inside them never splits a declaration.
 */
public class DeclarationReader
{
	private static final Separator EQUALS = Separator.byText("=");
	private static final Separator COMMA = Separator.byText(",");
	private static final Separator COLON = Separator.byText(":");
	private static final Separator FROM = Separator.byText("from");

	/**
	 * Reads every top-level entry of {@code block}; comment-only and blank
	 * statements are skipped.
	 *
	 * @throws TokenError at the first malformed declaration.
	 */
	public List<Declaration> read(Block block)
	{
		List<Declaration> declarations = new ArrayList<>();
		for (Block.Entry entry : block.getEntries())
		{
			List<Fragment> fragments = Tokens.stripWhitespace(entry.statement().getFragments());
			if (!fragments.isEmpty())
			{
				declarations.add(read(fragments, entry.body()));
			}
		}
		return declarations;
	}

	private Declaration read(List<Fragment> fragments, Block body)
	{
		Partition<Fragment> assignment = Tokens.partition(fragments, EQUALS);
		if (!assignment.isMatched())
		{
			throw new TokenError("expected '='", fragments.get(0).firstToken().getStart());
		}
		Token equals = (Token) assignment.separator().get();
		List<String> names = readNames(assignment.before(), equals);

		List<Fragment> value = assignment.restAsList();
		if (!body.isEmpty())
		{
			Partition<Fragment> header = Tokens.rpartition(value, COLON);
			if (!header.isMatched() || header.rest().hasNext())
			{
				Token where = value.isEmpty() ? equals : value.get(value.size() - 1).firstToken();
				throw new TokenError("expected ':' before nested block", where.getStart());
			}
			value = header.before();
		}

		Partition<Fragment> source = Tokens.partition(value, FROM);
		if (source.before().isEmpty())
		{
			throw new TokenError("expected an expression", equals.getStart());
		}
		Optional<List<Fragment>> context = Optional.empty();
		if (source.isMatched())
		{
			List<Fragment> contextFragments = source.restAsList();
			if (contextFragments.isEmpty())
			{
				throw new TokenError("expected an expression", ((Token) source.separator().get()).getStart());
			}
			context = Optional.of(contextFragments);
		}
		return new Declaration(names, source.before(), context, body);
	}

	/**
	 * Splits the comma-separated names left of {@code =}, one lazy partition at a time.
	 */
	private List<String> readNames(List<Fragment> target, Token equals)
	{
		List<String> names = new ArrayList<>();
		Iterator<Fragment> rest = target.iterator();
		boolean more = true;
		while (more)
		{
			Partition<Fragment> piece = Tokens.partition(rest, COMMA);
			List<Fragment> name = piece.before();
			if (name.size() != 1 || !(name.get(0) instanceof Token token) || token.getType() != TokenType.NAME)
			{
				Token where = name.isEmpty()
						? piece.separator().map(Fragment::firstToken).orElse(equals)
						: name.get(0).firstToken();
				throw new TokenError("expected a name", where.getStart());
			}
			names.add(token.getText());
			more = piece.isMatched();
			rest = piece.rest();
		}
		return names;
	}
}
