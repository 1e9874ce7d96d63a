package domain.generate;

/** SELECT of one source table: projection, FROM and optional GROUP BY. */
final class SourceSelect {

    final String sourceTable;

    /** FROM alias, null for none. */
    final String alias;
    final SelectProjection projection;

    SourceSelect(String sourceTable, String alias, SelectProjection projection) {
        this.sourceTable = sourceTable;
        this.alias = alias;
        this.projection = projection;
    }

    String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("SELECT ").append(projection.selectList()).append('\n');
        sb.append("FROM ").append(SqlTokens.tableRef(sourceTable));
        if (alias != null) sb.append(" AS ").append(alias);
        if (!projection.groupBy().isEmpty()) {
            sb.append('\n').append("GROUP BY ").append(String.join(", ", projection.groupBy()));
        }
        return sb.toString();
    }
}
