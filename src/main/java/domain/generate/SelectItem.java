package domain.generate;

/** One {@code expression AS alias} entry of a SELECT list. */
final class SelectItem {

    final String expression;
    final String alias;

    SelectItem(String expression, String alias) {
        this.expression = expression;
        this.alias = alias;
    }

    String render() {
        return expression + " AS " + alias;
    }

    @Override
    public String toString() {
        return render();
    }
}
