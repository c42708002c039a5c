/**
 * Copyright (C) 2023 - present by Marc Henrard.
 */
package marc.henrard.floatperiod.product.period;

import org.joda.convert.FromString;
import org.joda.convert.ToString;

import com.opengamma.strata.collect.named.EnumNames;
import com.opengamma.strata.collect.named.NamedEnum;

/**
 * The way the spread of a floating period is combined with the compounded overnight rates.
 */
public enum SpreadCompoundMethod implements NamedEnum {

  /**
   * The spread is added to the compounded rate.
   */
  NONE_SIMPLE,
  /**
   * The spread is added to each overnight rate before compounding.
   */
  ISDA_COMPOUNDING,
  /**
   * The spread interest accrues flat; the interest of each date is compounded once at the
   * next date's rate.
   */
  ISDA_FLAT_COMPOUNDING;

  // helper for name conversions
  private static final EnumNames<SpreadCompoundMethod> NAMES = EnumNames.of(SpreadCompoundMethod.class);

  //-------------------------------------------------------------------------
  /**
   * Obtains an instance from the specified name.
   * <p>
   * Parsing handles the mixed case and lower case forms, e.g. 'isda_compounding'.
   * 
   * @param name  the name to parse
   * @return the type
   * @throws IllegalArgumentException if the name is not known
   */
  @FromString
  public static SpreadCompoundMethod of(String name) {
    return NAMES.parse(name);
  }

  //-------------------------------------------------------------------------
  /**
   * Returns the formatted name of the type.
   * 
   * @return the formatted string representing the type
   */
  @ToString
  @Override
  public String toString() {
    return NAMES.format(this);
  }

}
