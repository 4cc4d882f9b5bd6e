package com.example.stitchschemata.command;

import com.example.stitchschemata.exception.StitchException;
import com.example.stitchschemata.model.PageSegMode;
import picocli.CommandLine;

public class PageSegModeConverter implements CommandLine.ITypeConverter<PageSegMode> {

    @Override
    public PageSegMode convert(String value) {
        try {
            return PageSegMode.parse(value);
        } catch (StitchException e) {
            throw new CommandLine.TypeConversionException(e.getMessage());
        }
    }
}
