/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language.operator;

import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorLogical;
import gov.sandia.ephys.language.OperatorUnary;
import gov.sandia.ephys.language.Renderer;

public class NOT extends OperatorUnary implements OperatorLogical
{
    public NOT (Operator operand)
    {
        super (operand);
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }

    public String toString ()
    {
        return "not";
    }
}
