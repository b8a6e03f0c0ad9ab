/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

import java.util.Objects;

import javax.measure.Unit;

import tech.units.indriya.AbstractUnit;

public class Constant extends Operator
{
    public final double  value;
    public final Unit<?> unit;  // null if no unit was given

    public Constant (double value)
    {
        this (value, null);
    }

    public Constant (double value, Unit<?> unit)
    {
        this.value = value;
        this.unit  = unit;
    }

    /**
        @return true if no unit is attached, or the attached unit is the plain number one.
    **/
    public boolean isDimensionless ()
    {
        return unit == null  ||  AbstractUnit.ONE.equals (unit);
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }

    /**
        Default text form of a number. Whole numbers print with a trailing ".0" rather than
        an exponent, up to the point where a double stops holding every integer exactly.
        Everything else uses the shortest text that reads back to the same double, with
        a lower-case exponent marker.
    **/
    public static String print (double d)
    {
        if (Double.isNaN (d)) return "NaN";
        if (Double.isInfinite (d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d != 0  &&  d == Math.rint (d)  &&  Math.abs (d) < 1e16) return (long) d + ".0";
        return Double.toString (d).replace ('E', 'e');
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof Constant)) return false;
        Constant c = (Constant) that;
        return Double.compare (value, c.value) == 0  &&  Objects.equals (unit, c.unit);
    }

    public int hashCode ()
    {
        return Double.hashCode (value) * 31 + Objects.hashCode (unit);
    }

    public String toString ()
    {
        return print (value);
    }
}
