/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

import javax.measure.Unit;
import javax.measure.format.UnitFormat;

import systems.uom.ucum.format.UCUMFormat;
import systems.uom.ucum.format.UCUMFormat.Variant;
import tech.units.indriya.AbstractUnit;

/**
    Reading and writing of physical units in UCUM notation.
**/
public class Units
{
    public static UnitFormat UCUM = UCUMFormat.getInstance (Variant.CASE_SENSITIVE);

    /**
        @return The unit named by the given UCUM text, or null if the text is empty or names
        a plain number ("1" or "dimensionless").
        @throws javax.measure.format.MeasurementParseException if the text is not a valid unit.
    **/
    public static Unit<?> parse (String unitString)
    {
        if (unitString == null) return null;
        unitString = unitString.trim ();
        if (unitString.isEmpty ()  ||  unitString.equals ("dimensionless")) return null;
        Unit<?> result = UCUM.parse (unitString);
        if (AbstractUnit.ONE.equals (result)) return null;
        return result;
    }

    public static String format (Unit<?> unit)
    {
        if (unit == null) return "";
        return UCUM.format (unit);
    }
}
