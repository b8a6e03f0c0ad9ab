/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language.function;

import gov.sandia.ephys.language.Function;
import gov.sandia.ephys.language.Operator;
import gov.sandia.ephys.language.Renderer;

public class Ceil extends Function
{
    public Ceil (Operator operand)
    {
        super (operand);
        checkArity (1);
    }

    public String name ()
    {
        return "ceil";
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }
}
