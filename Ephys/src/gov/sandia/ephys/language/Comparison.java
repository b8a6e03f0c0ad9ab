/*
Copyright 2017-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

public abstract class Comparison extends OperatorBinary implements OperatorLogical
{
    protected Comparison (Operator operand0, Operator operand1)
    {
        super (operand0, operand1);
    }

    public int precedence ()
    {
        return COMPARISON;
    }
}
