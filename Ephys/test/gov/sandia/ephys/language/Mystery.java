/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    A node kind that no renderer knows about.
**/
public class Mystery extends Operator
{
    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }
}
