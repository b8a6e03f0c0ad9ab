/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language.operator;

import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.OperatorBinary;
import gov.sandia.ephys.language.Renderer;

public class Divide extends OperatorBinary
{
    public Divide (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public int precedence ()
    {
        return PRODUCT;
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }

    public String toString ()
    {
        return "/";
    }
}
