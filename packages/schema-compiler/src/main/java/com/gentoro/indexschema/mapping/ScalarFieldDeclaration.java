package com.gentoro.indexschema.mapping;

import com.gentoro.indexschema.annotation.MultiField;
import com.gentoro.indexschema.annotation.Property;
import com.gentoro.indexschema.utility.JacksonUtility;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Declaration of a leaf schema field, read from {@link Property}. */
public record ScalarFieldDeclaration(
    String name,
    String type,
    String analyzer,
    String searchAnalyzer,
    String searchQuoteAnalyzer,
    List<SubField> fields,
    Map<String, Object> settings)
    implements FieldDeclaration {

  public ScalarFieldDeclaration {
    fields = fields == null ? List.of() : List.copyOf(fields);
    settings = settings == null ? Map.of() : settings;
  }

  public static ScalarFieldDeclaration from(Property property) {
    return new ScalarFieldDeclaration(
        blankToNull(property.name()),
        blankToNull(property.type()),
        blankToNull(property.analyzer()),
        blankToNull(property.searchAnalyzer()),
        blankToNull(property.searchQuoteAnalyzer()),
        Arrays.stream(property.fields()).map(SubField::from).toList(),
        JacksonUtility.readJsonObject(property.settings()));
  }

  @Override
  public Map<String, Object> toSettings() {
    return new LinkedHashMap<>(settings);
  }

  /** Sub-field mappings keyed by sub-field name, in declaration order. */
  public Map<String, Object> fieldsMapping() {
    Map<String, Object> result = new LinkedHashMap<>();
    for (SubField field : fields) {
      result.put(field.name(), field.toMapping());
    }
    return result;
  }

  /** One entry of {@link Property#fields()}. */
  public record SubField(
      String name,
      String type,
      String analyzer,
      String searchAnalyzer,
      Map<String, Object> settings) {

    static SubField from(MultiField field) {
      return new SubField(
          field.name(),
          blankToNull(field.type()),
          blankToNull(field.analyzer()),
          blankToNull(field.searchAnalyzer()),
          JacksonUtility.readJsonObject(field.settings()));
    }

    Map<String, Object> toMapping() {
      Map<String, Object> mapping = new LinkedHashMap<>(settings);
      if (type != null) mapping.put("type", type);
      if (analyzer != null) mapping.put("analyzer", analyzer);
      if (searchAnalyzer != null) mapping.put("search_analyzer", searchAnalyzer);
      return mapping;
    }
  }

  static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
