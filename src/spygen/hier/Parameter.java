package spygen.hier;

/**
 * A module parameter.
 * @param name the parameter name
 * @param type the declared type, empty if the declaration has none
 * @param defaultValue the default value expression, empty if the declaration has none
 */
public record Parameter(String name, String type, String defaultValue) {}
