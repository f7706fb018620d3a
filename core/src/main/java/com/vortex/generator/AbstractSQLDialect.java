package com.vortex.generator;

import com.vortex.logql.MatchType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Shared rendering for the built-in dialects.
 *
 * <p>Subclasses supply the identifier quote character, the LIKE escape
 * character and the engine functions; substring containment is rendered the
 * same way everywhere:
 * <pre>
 *   subject LIKE ?          -- '%' + escaped substring + '%'
 *   subject NOT LIKE ?
 * </pre>
 */
public abstract class AbstractSQLDialect implements SQLDialect {

    private static final Set<MatchType> ALL_MATCH_TYPES = EnumSet.allOf(MatchType.class);

    /**
     * Returns the character used to quote identifiers.
     */
    protected abstract char identifierQuote();

    /**
     * Returns the escape character of LIKE patterns.
     */
    protected abstract char likeEscape();

    /**
     * Returns the clause declaring the escape character after a LIKE
     * pattern, or an empty string when the engine's default applies.
     */
    protected String likeEscapeClause() {
        return "";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return SQLQuoting.quoteIdentifier(identifier, identifierQuote());
    }

    @Override
    public String qualifiedTable(String database, String table) {
        return SQLQuoting.quoteTableName(database, identifierQuote()) + "." +
               SQLQuoting.quoteTableName(table, identifierQuote());
    }

    @Override
    public SQLFragment contains(SQLFragment subject, String substring, boolean negated) {
        String pattern = "%" + SQLQuoting.escapeLikePattern(substring, likeEscape()) + "%";
        String operator = negated ? " NOT LIKE ?" : " LIKE ?";
        return subject.append(operator + likeEscapeClause(), pattern);
    }

    @Override
    public Set<MatchType> supportedMatchTypes() {
        return ALL_MATCH_TYPES;
    }

    @Override
    public String toString() {
        return name();
    }
}
