package com.example.stitchschemata.command;

import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.model.TileHint;
import picocli.CommandLine;

public class TileHintConverter implements CommandLine.ITypeConverter<TileHint> {

    @Override
    public TileHint convert(String value) {
        try {
            return TileHint.parse(value);
        } catch (StitchException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
