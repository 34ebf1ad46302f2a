package org.dice.kripke.parsing.ast;

import java.util.List;

/**
 * <iff>::=<implies>[<iff-op><iff>]
 * <implies>::=<or>[<implies-op><implies>]
 * <or>::=<and>{<or-op><and>}
 * <and>::=<unary>{<and-op><unary>}
 * <unary>::=<not><unary>|<box><unary>|<diamond><unary>|<primary>
 * <primary>::=<atom>|<constant>|(<iff>)
 * <constant>::= false|true
 * <iff-op>::='<->'
 * <implies-op>::='->'
 * <or-op>::='|'
 * <and-op>::='&'
 * <not>::='~'
 * <box>::='[' [agent] ']'
 * <diamond>::='<' [agent] '>'
 */
public interface Expression {

	<R> R accept(ExpressionVisitor<R> visitor);

	/**
	 * Canonical text of this expression. Binary operators are always parenthesized, so
	 * parsing the result gives back an equal tree.
	 */
	String render();

	List<Expression> children();

	int depth();
}
