/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.mathml;

import javax.measure.Unit;

import org.w3c.dom.Element;

import gov.sandia.ephys.language.Constant;
import gov.sandia.ephys.language.Units;

/**
    Creates numbers that carry the physical unit named in the "units" attribute of their cn element,
    written in UCUM notation. A prefixed attribute such as cellml:units is also accepted.
    Numbers without the attribute, or marked "dimensionless", carry no unit.
**/
public class UnitNumberFactory implements ImportMathML.NumberFactory
{
    public Constant create (double value, Element element)
    {
        if (element == null) return new Constant (value);
        Unit<?> unit = Units.parse (XMLutility.getAttribute (element, "units"));
        return new Constant (value, unit);
    }
}
